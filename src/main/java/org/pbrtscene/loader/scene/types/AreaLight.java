package org.pbrtscene.loader.scene.types;

import org.pbrtscene.loader.api.SceneLoadException;
import org.pbrtscene.loader.frontend.param.ParamList;
import org.pbrtscene.loader.frontend.param.Spectrum;

/**
 * Emission attached to the shapes that follow an {@code AreaLightSource} directive.
 */
public sealed interface AreaLight {

    record Diffuse(Spectrum radiance, float scale, boolean twoSided, String fileName, float power)
            implements AreaLight {}

    static AreaLight create(String type, ParamList params) throws SceneLoadException {
        if (!"diffuse".equals(type)) {
            throw ParamReader.unsupported("area light", type);
        }
        return new Diffuse(
                ParamReader.spectrum(params, "L"),
                params.getFloat("scale", 1.0f),
                params.getBoolean("twosided", false),
                params.getString("filename", ""),
                params.getFloat("power", -1.0f));
    }
}
