package org.pbrtscene.loader.scene.types;

import org.pbrtscene.loader.api.SceneLoadException;
import org.pbrtscene.loader.frontend.param.ParamList;
import org.pbrtscene.loader.frontend.param.Spectrum;

/**
 * Light sources. A null spectrum stands for the color space's standard illuminant.
 * A negative {@code power} or {@code illuminance} means "not specified".
 */
public sealed interface Light {

    float scale();

    record Point(float scale, float power, Spectrum intensity, float[] from) implements Light {

        public Point {
            from = ParamReader.copy(from);
        }

        @Override
        public float[] from() {
            return ParamReader.copy(from);
        }
    }

    record Spot(float scale, float power, Spectrum intensity, float[] from, float[] to,
                float coneAngle, float coneDeltaAngle) implements Light {

        public Spot {
            from = ParamReader.copy(from);
            to = ParamReader.copy(to);
        }

        @Override
        public float[] from() {
            return ParamReader.copy(from);
        }

        @Override
        public float[] to() {
            return ParamReader.copy(to);
        }
    }

    record Distant(float scale, float illuminance, Spectrum radiance, float[] from, float[] to) implements Light {

        public Distant {
            from = ParamReader.copy(from);
            to = ParamReader.copy(to);
        }

        @Override
        public float[] from() {
            return ParamReader.copy(from);
        }

        @Override
        public float[] to() {
            return ParamReader.copy(to);
        }
    }

    record Infinite(float scale, float illuminance, Spectrum radiance, String fileName, float[] portal)
            implements Light {

        public Infinite {
            portal = ParamReader.copy(portal);
        }

        @Override
        public float[] portal() {
            return ParamReader.copy(portal);
        }
    }

    record Goniometric(float scale, float power, Spectrum intensity, String fileName) implements Light {}

    record Projection(float scale, float power, String fileName, float fov) implements Light {}

    static Light create(String type, ParamList params) throws SceneLoadException {
        float scale = params.getFloat("scale", 1.0f);
        float power = params.getFloat("power", -1.0f);
        return switch (type) {
            case "point" -> new Point(scale, power,
                    ParamReader.spectrum(params, "I"),
                    ParamReader.tuple(params, "from", 3, new float[]{0, 0, 0}));
            case "spot" -> new Spot(scale, power,
                    ParamReader.spectrum(params, "I"),
                    ParamReader.tuple(params, "from", 3, new float[]{0, 0, 0}),
                    ParamReader.tuple(params, "to", 3, new float[]{0, 0, 1}),
                    params.getFloat("coneangle", 30.0f),
                    params.getFloat("conedeltaangle", 5.0f));
            case "distant" -> new Distant(scale,
                    params.getFloat("illuminance", -1.0f),
                    ParamReader.spectrum(params, "L"),
                    ParamReader.tuple(params, "from", 3, new float[]{0, 0, 0}),
                    ParamReader.tuple(params, "to", 3, new float[]{0, 0, 1}));
            case "infinite" -> infinite(scale, params);
            case "goniometric" -> new Goniometric(scale, power,
                    ParamReader.spectrum(params, "I"),
                    params.getString("filename", ""));
            case "projection" -> new Projection(scale, power,
                    params.getString("filename", ""),
                    params.getFloat("fov", 90.0f));
            default -> throw ParamReader.unsupported("light", type);
        };
    }

    private static Infinite infinite(float scale, ParamList params) throws SceneLoadException {
        Spectrum radiance = ParamReader.spectrum(params, "L");
        String fileName = params.getString("filename", "");
        if (radiance != null && !fileName.isEmpty()) {
            throw ParamReader.invalid("filename", "cannot be combined with \"L\"");
        }
        float[] portal = ParamReader.floatArray(params, "portal");
        if (portal.length != 0 && portal.length != 12) {
            throw ParamReader.invalid("portal", "expected 4 points, got " + portal.length + " values");
        }
        return new Infinite(scale, params.getFloat("illuminance", -1.0f), radiance, fileName, portal);
    }
}
