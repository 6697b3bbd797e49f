package org.pbrtscene.loader.scene.types;

import org.pbrtscene.loader.api.SceneLoadException;
import org.pbrtscene.loader.frontend.param.ParamList;

import java.util.Locale;

/**
 * The light transport algorithm and its common settings.
 */
public record Integrator(
        Kind kind,
        int maxDepth,
        boolean regularize,
        String lightSampler
) {

    public enum Kind {
        VOLPATH, PATH, SIMPLEPATH, SIMPLEVOLPATH, BDPT, LIGHTPATH, MLT, SPPM, RANDOMWALK, AMBIENTOCCLUSION, AOV
    }

    static Integrator create(String type, ParamList params) throws SceneLoadException {
        Kind kind;
        try {
            kind = Kind.valueOf(type.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw ParamReader.unsupported("integrator", type);
        }
        return new Integrator(kind,
                params.getInteger("maxdepth", 5),
                params.getBoolean("regularize", false),
                params.getString("lightsampler", "bvh"));
    }
}
