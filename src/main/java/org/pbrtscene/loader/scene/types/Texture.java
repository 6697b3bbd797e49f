package org.pbrtscene.loader.scene.types;

import org.pbrtscene.loader.api.SceneLoadException;
import org.pbrtscene.loader.frontend.param.ParamList;

import java.util.Map;

/**
 * A named texture: its value type, its (u,v) mapping and the generator that produces its values.
 */
public record Texture(String name, ValueType valueType, Mapping mapping, Kind kind) {

    public enum ValueType { FLOAT, SPECTRUM }

    /**
     * How surface points map to texture coordinates.
     *
     * @param type One of {@code uv}, {@code spherical}, {@code cylindrical}, {@code planar}.
     * @param v1 First planar axis, only meaningful for {@code planar}.
     * @param v2 Second planar axis, only meaningful for {@code planar}.
     */
    public record Mapping(String type, float uScale, float vScale, float uDelta, float vDelta,
                          float[] v1, float[] v2) {

        public Mapping {
            v1 = ParamReader.copy(v1);
            v2 = ParamReader.copy(v2);
        }

        @Override
        public float[] v1() {
            return ParamReader.copy(v1);
        }

        @Override
        public float[] v2() {
            return ParamReader.copy(v2);
        }
    }

    public sealed interface Kind {}

    public record Constant(ShadingInput value) implements Kind {}

    public record ImageMap(String fileName, String filter, float maxAnisotropy, String wrap, float scale,
                           boolean invert, String encoding) implements Kind {}

    public record Scale(ShadingInput texture, ShadingInput scale) implements Kind {}

    public record Mix(ShadingInput texture1, ShadingInput texture2, ShadingInput amount) implements Kind {}

    public record DirectionMix(ShadingInput texture1, ShadingInput texture2, float[] direction) implements Kind {

        public DirectionMix {
            direction = ParamReader.copy(direction);
        }

        @Override
        public float[] direction() {
            return ParamReader.copy(direction);
        }
    }

    public record Checkerboard(int dimension, ShadingInput texture1, ShadingInput texture2) implements Kind {}

    public record Bilerp(ShadingInput v00, ShadingInput v01, ShadingInput v10, ShadingInput v11)
            implements Kind {}

    public record Ptex(String fileName, float scale, String encoding) implements Kind {}

    public record Fbm(int octaves, float roughness) implements Kind {}

    public record Wrinkled(int octaves, float roughness) implements Kind {}

    public record Windy() implements Kind {}

    public record Marble(int octaves, float roughness, float scale, float variation) implements Kind {}

    public record Dots(ShadingInput inside, ShadingInput outside) implements Kind {}

    static Texture create(String name, String valueType, String textureClass, ParamList params,
                          Map<String, Integer> textures) throws SceneLoadException {
        ValueType type = switch (valueType) {
            case "float" -> ValueType.FLOAT;
            case "spectrum" -> ValueType.SPECTRUM;
            default -> throw ParamReader.unsupported("texture value", valueType);
        };
        Mapping mapping = new Mapping(
                params.getString("mapping", "uv"),
                params.getFloat("uscale", 1.0f),
                params.getFloat("vscale", 1.0f),
                params.getFloat("udelta", 0.0f),
                params.getFloat("vdelta", 0.0f),
                ParamReader.tuple(params, "v1", 3, new float[]{1, 0, 0}),
                ParamReader.tuple(params, "v2", 3, new float[]{0, 1, 0}));
        return new Texture(name, type, mapping, kind(textureClass, params, textures));
    }

    private static Kind kind(String textureClass, ParamList params, Map<String, Integer> textures)
            throws SceneLoadException {
        ParamReader.Inputs in = new ParamReader.Inputs(params, textures);
        String defaultEncoding = params.getString("filename", "").endsWith(".png") ? "sRGB" : "linear";
        return switch (textureClass) {
            case "constant" -> new Constant(in.get("value", 1.0f));
            case "imagemap" -> new ImageMap(
                    params.getString("filename", ""),
                    params.getString("filter", "bilinear"),
                    params.getFloat("maxanisotropy", 8.0f),
                    params.getString("wrap", "repeat"),
                    params.getFloat("scale", 1.0f),
                    params.getBoolean("invert", false),
                    params.getString("encoding", defaultEncoding));
            case "scale" -> new Scale(in.get("tex", 1.0f), in.get("scale", 1.0f));
            case "mix" -> new Mix(in.get("tex1", 0.0f), in.get("tex2", 1.0f), in.get("amount", 0.5f));
            case "directionmix" -> new DirectionMix(in.get("tex1", 0.0f), in.get("tex2", 1.0f),
                    ParamReader.tuple(params, "dir", 3, new float[]{0, 1, 0}));
            case "checkerboard" -> checkerboard(params, in);
            case "bilerp" -> new Bilerp(in.get("v00", 0.0f), in.get("v01", 1.0f),
                    in.get("v10", 0.0f), in.get("v11", 1.0f));
            case "ptex" -> new Ptex(
                    params.getString("filename", ""),
                    params.getFloat("scale", 1.0f),
                    params.getString("encoding", "gamma 2.2"));
            case "fbm" -> new Fbm(params.getInteger("octaves", 8), params.getFloat("roughness", 0.5f));
            case "wrinkled" -> new Wrinkled(params.getInteger("octaves", 8), params.getFloat("roughness", 0.5f));
            case "windy" -> new Windy();
            case "marble" -> new Marble(
                    params.getInteger("octaves", 8),
                    params.getFloat("roughness", 0.5f),
                    params.getFloat("scale", 1.0f),
                    params.getFloat("variation", 0.2f));
            case "dots" -> new Dots(in.get("inside", 1.0f), in.get("outside", 0.0f));
            default -> throw ParamReader.unsupported("texture", textureClass);
        };
    }

    private static Checkerboard checkerboard(ParamList params, ParamReader.Inputs in) throws SceneLoadException {
        int dimension = params.getInteger("dimension", 2);
        if (dimension != 2 && dimension != 3) {
            throw ParamReader.invalid("dimension", dimension + " is not 2 or 3");
        }
        return new Checkerboard(dimension, in.get("tex1", 1.0f), in.get("tex2", 0.0f));
    }
}
