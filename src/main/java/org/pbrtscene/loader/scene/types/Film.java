package org.pbrtscene.loader.scene.types;

import org.pbrtscene.loader.api.SceneLoadException;
import org.pbrtscene.loader.frontend.param.ParamList;

/**
 * The film: output resolution, image file and sensor settings.
 */
public record Film(
        Kind kind,
        int xResolution,
        int yResolution,
        float[] cropWindow,
        float diagonal,
        String fileName,
        boolean saveFp16,
        float iso,
        float whiteBalance,
        String sensor,
        float maxComponentValue
) {

    public enum Kind { RGB, GBUFFER, SPECTRAL }

    public Film {
        cropWindow = ParamReader.copy(cropWindow);
    }

    @Override
    public float[] cropWindow() {
        return ParamReader.copy(cropWindow);
    }

    static Film create(String type, ParamList params) throws SceneLoadException {
        Kind kind = switch (type) {
            case "rgb" -> Kind.RGB;
            case "gbuffer" -> Kind.GBUFFER;
            case "spectral" -> Kind.SPECTRAL;
            default -> throw ParamReader.unsupported("film", type);
        };
        return new Film(kind,
                params.getInteger("xresolution", 1280),
                params.getInteger("yresolution", 720),
                ParamReader.tuple(params, "cropwindow", 4, new float[]{0, 1, 0, 1}),
                params.getFloat("diagonal", 35.0f),
                params.getString("filename", "pbrt.exr"),
                params.getBoolean("savefp16", true),
                params.getFloat("iso", 100.0f),
                params.getFloat("whitebalance", 0.0f),
                params.getString("sensor", "cie1931"),
                params.getFloat("maxcomponentvalue", Float.POSITIVE_INFINITY));
    }
}
