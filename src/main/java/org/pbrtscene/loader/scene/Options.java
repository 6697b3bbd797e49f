package org.pbrtscene.loader.scene;

import org.pbrtscene.loader.api.SceneErrorCode;
import org.pbrtscene.loader.api.SceneLoadException;
import org.pbrtscene.loader.frontend.param.Param;
import org.pbrtscene.loader.frontend.param.ParamType;

/**
 * Scene-wide rendering options, set by {@code Option} and {@code ColorSpace} directives.
 */
public final class Options {

    private boolean disablePixelJitter;
    private boolean disableTextureFiltering;
    private boolean disableWavelengthJitter;
    private float displacementEdgeScale = 1.0f;
    private String mseReferenceImage;
    private String mseReferenceOut;
    private RenderCoordinateSystem renderCoordSys = RenderCoordinateSystem.CAMERAWORLD;
    private int seed;
    private String colorSpace = "srgb";

    /**
     * Applies a single {@code Option} parameter.
     * @param param The parameter, e.g. {@code "bool disablepixeljitter" true}.
     * @throws SceneLoadException with {@link SceneErrorCode#UNKNOWN_OPTION} for an unknown name, or
     *         {@link SceneErrorCode#INVALID_OPTION_VALUE} for a value of the wrong type or an unknown keyword.
     */
    void apply(Param param) throws SceneLoadException {
        switch (param.name()) {
            case "disablepixeljitter" -> disablePixelJitter = bool(param);
            case "disabletexturefiltering" -> disableTextureFiltering = bool(param);
            case "disablewavelengthjitter" -> disableWavelengthJitter = bool(param);
            case "displacementedgescale" -> displacementEdgeScale = floatValue(param);
            case "msereferenceimage" -> mseReferenceImage = string(param);
            case "msereferenceout" -> mseReferenceOut = string(param);
            case "rendercoordsys" -> {
                String keyword = string(param);
                renderCoordSys = RenderCoordinateSystem.fromKeyword(keyword)
                        .orElseThrow(() -> invalid(param, "unknown coordinate system '" + keyword + "'"));
            }
            case "seed" -> seed = integer(param);
            default -> throw new SceneLoadException(SceneErrorCode.UNKNOWN_OPTION,
                    "Unknown option '" + param.name() + "'");
        }
    }

    void setColorSpace(String colorSpace) {
        this.colorSpace = colorSpace;
    }

    public boolean isDisablePixelJitter() {
        return disablePixelJitter;
    }

    public boolean isDisableTextureFiltering() {
        return disableTextureFiltering;
    }

    public boolean isDisableWavelengthJitter() {
        return disableWavelengthJitter;
    }

    public float getDisplacementEdgeScale() {
        return displacementEdgeScale;
    }

    /**
     * @return The reference image file name, or null if not set.
     */
    public String getMseReferenceImage() {
        return mseReferenceImage;
    }

    /**
     * @return The per-sample error output file name, or null if not set.
     */
    public String getMseReferenceOut() {
        return mseReferenceOut;
    }

    public RenderCoordinateSystem getRenderCoordSys() {
        return renderCoordSys;
    }

    public int getSeed() {
        return seed;
    }

    public String getColorSpace() {
        return colorSpace;
    }

    private static boolean bool(Param param) throws SceneLoadException {
        return param.booleans().filter(v -> v.length == 1).map(v -> v[0])
                .orElseThrow(() -> invalid(param, "expected a single bool"));
    }

    private static float floatValue(Param param) throws SceneLoadException {
        if (param.type() != ParamType.FLOAT) {
            throw invalid(param, "expected a float");
        }
        return param.floats().filter(v -> v.length == 1).map(v -> v[0])
                .orElseThrow(() -> invalid(param, "expected a single float"));
    }

    private static int integer(Param param) throws SceneLoadException {
        if (param.type() != ParamType.INTEGER) {
            throw invalid(param, "expected an integer");
        }
        return param.integers().filter(v -> v.length == 1).map(v -> v[0])
                .orElseThrow(() -> invalid(param, "expected a single integer"));
    }

    private static String string(Param param) throws SceneLoadException {
        if (param.type() != ParamType.STRING) {
            throw invalid(param, "expected a string");
        }
        return param.strings().filter(v -> v.size() == 1).map(v -> v.get(0))
                .orElseThrow(() -> invalid(param, "expected a single string"));
    }

    private static SceneLoadException invalid(Param param, String reason) {
        return new SceneLoadException(SceneErrorCode.INVALID_OPTION_VALUE,
                "Invalid value for option '" + param.name() + "': " + reason);
    }
}
