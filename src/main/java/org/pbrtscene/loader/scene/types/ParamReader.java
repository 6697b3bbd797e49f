package org.pbrtscene.loader.scene.types;

import org.pbrtscene.loader.api.SceneErrorCode;
import org.pbrtscene.loader.api.SceneLoadException;
import org.pbrtscene.loader.frontend.param.Param;
import org.pbrtscene.loader.frontend.param.ParamList;
import org.pbrtscene.loader.frontend.param.ParamType;
import org.pbrtscene.loader.frontend.param.Spectrum;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Shared helpers for the entity factories: arity-checked reads and shading-input resolution.
 * Everything returned is a copy, so no entity shares state with a parameter table.
 */
final class ParamReader {

    private ParamReader() {}

    /**
     * Reads a fixed-size float tuple, e.g. a point3.
     * @return The values, or {@code defaultValue} if the parameter is absent.
     * @throws SceneLoadException if the parameter is present with the wrong number of values.
     */
    static float[] tuple(ParamList params, String name, int arity, float[] defaultValue) throws SceneLoadException {
        Optional<float[]> values = params.floats(name);
        if (values.isEmpty()) {
            return defaultValue;
        }
        if (values.get().length != arity) {
            throw invalid(name, "expected " + arity + " values, got " + values.get().length);
        }
        return values.get();
    }

    static float[] copy(float[] values) {
        return values == null ? null : values.clone();
    }

    static int[] copy(int[] values) {
        return values == null ? null : values.clone();
    }

    /**
     * @return The float values of the parameter, or an empty array.
     */
    static float[] floatArray(ParamList params, String name) {
        return params.floats(name).orElse(new float[0]);
    }

    /**
     * @return The integer values of the parameter, or an empty array.
     */
    static int[] intArray(ParamList params, String name) {
        return params.integers(name).orElse(new int[0]);
    }

    /**
     * @return The string values of the parameter, or an empty list.
     */
    static List<String> stringList(ParamList params, String name) {
        return params.strings(name).orElse(List.of());
    }

    /**
     * Reads an rgb or blackbody parameter.
     * @return The spectrum, or null if absent.
     * @throws SceneLoadException if the parameter is an rgb with other than three values.
     */
    static Spectrum spectrum(ParamList params, String name) throws SceneLoadException {
        Optional<Param> param = params.get(name);
        if (param.isEmpty()) {
            return null;
        }
        if (param.get().type() == ParamType.RGB && param.get().size() != 3) {
            throw invalid(name, "rgb needs exactly 3 values, got " + param.get().size());
        }
        return param.get().spectrum().orElse(null);
    }

    /**
     * Resolves a value that may be given as a float, a spectrum, or a reference to a named texture.
     *
     * @param textures Texture name to index in the scene's texture list.
     * @return The input, or {@code defaultValue} if the parameter is absent.
     * @throws SceneLoadException if a referenced texture is unknown or a value is malformed.
     */
    static ShadingInput input(ParamList params, String name, ShadingInput defaultValue,
                              Map<String, Integer> textures) throws SceneLoadException {
        Optional<Param> found = params.get(name);
        if (found.isEmpty()) {
            return defaultValue;
        }
        Param param = found.get();
        switch (param.type()) {
            case TEXTURE: {
                String textureName = param.strings().filter(s -> !s.isEmpty()).map(s -> s.get(0))
                        .orElseThrow(() -> invalid(name, "texture reference without a name"));
                Integer index = textures.get(textureName);
                if (index == null) {
                    throw invalid(name, "unknown texture '" + textureName + "'");
                }
                return new ShadingInput.TextureRef(textureName, index);
            }
            case RGB:
            case BLACKBODY:
                return new ShadingInput.Color(spectrum(params, name));
            case SPECTRUM:
                return new ShadingInput.Sampled(param.floats().orElse(new float[0]));
            case FLOAT: {
                float[] values = param.floats().orElse(new float[0]);
                if (values.length == 0) {
                    throw invalid(name, "no value");
                }
                return new ShadingInput.Constant(values[0]);
            }
            default:
                throw invalid(name, "type '" + param.type().keyword() + "' cannot be used as a shading input");
        }
    }

    static SceneLoadException invalid(String name, String reason) {
        return new SceneLoadException(SceneErrorCode.INVALID_PARAMETER_VALUE,
                "Invalid parameter '" + name + "': " + reason);
    }

    static SceneLoadException unsupported(String category, String type) {
        return new SceneLoadException(SceneErrorCode.UNSUPPORTED_TYPE,
                "Unsupported " + category + " type '" + type + "'");
    }

    /**
     * Reads shading inputs against one parameter table and texture map.
     */
    static final class Inputs {
        private final ParamList params;
        private final Map<String, Integer> textures;

        Inputs(ParamList params, Map<String, Integer> textures) {
            this.params = params;
            this.textures = textures;
        }

        ShadingInput get(String name, float defaultValue) throws SceneLoadException {
            return input(params, name, new ShadingInput.Constant(defaultValue), textures);
        }

        ShadingInput get(String name, ShadingInput defaultValue) throws SceneLoadException {
            return input(params, name, defaultValue, textures);
        }

        // "roughness" sets both directions
        ShadingInput roughness(String name) throws SceneLoadException {
            String prefix = name.substring(0, name.length() - "uroughness".length());
            return get(name, get(prefix + "roughness", 0.0f));
        }
    }
}
