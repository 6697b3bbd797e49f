package org.pbrtscene.loader.scene.types;

import org.pbrtscene.loader.api.SceneLoadException;
import org.pbrtscene.loader.frontend.param.ParamList;

/**
 * The pixel reconstruction filter. Parameters that a kind does not use are zero.
 */
public record Filter(
        Kind kind,
        float xRadius,
        float yRadius,
        float sigma,
        float b,
        float c,
        float tau
) {

    public enum Kind { BOX, GAUSSIAN, MITCHELL, SINC, TRIANGLE }

    static Filter create(String type, ParamList params) throws SceneLoadException {
        return switch (type) {
            case "box" -> withRadius(Kind.BOX, params, 0.5f, 0, 0, 0, 0);
            case "gaussian" -> withRadius(Kind.GAUSSIAN, params, 1.5f,
                    params.getFloat("sigma", 0.5f), 0, 0, 0);
            case "mitchell" -> withRadius(Kind.MITCHELL, params, 2.0f, 0,
                    params.getFloat("B", 1.0f / 3.0f), params.getFloat("C", 1.0f / 3.0f), 0);
            case "sinc" -> withRadius(Kind.SINC, params, 4.0f, 0, 0, 0, params.getFloat("tau", 3.0f));
            case "triangle" -> withRadius(Kind.TRIANGLE, params, 2.0f, 0, 0, 0, 0);
            default -> throw ParamReader.unsupported("filter", type);
        };
    }

    private static Filter withRadius(Kind kind, ParamList params, float defaultRadius,
                                     float sigma, float b, float c, float tau) {
        return new Filter(kind,
                params.getFloat("xradius", defaultRadius),
                params.getFloat("yradius", defaultRadius),
                sigma, b, c, tau);
    }
}
