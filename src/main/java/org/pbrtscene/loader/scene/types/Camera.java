package org.pbrtscene.loader.scene.types;

import org.pbrtscene.loader.api.SceneLoadException;
import org.pbrtscene.loader.frontend.param.ParamList;

/**
 * Camera kinds with their parameters, defaults applied.
 */
public sealed interface Camera {

    float shutterOpen();

    float shutterClose();

    record Perspective(float shutterOpen, float shutterClose, float fov, float lensRadius,
                       float focalDistance, float frameAspectRatio, float[] screenWindow) implements Camera {

        public Perspective {
            screenWindow = ParamReader.copy(screenWindow);
        }

        @Override
        public float[] screenWindow() {
            return ParamReader.copy(screenWindow);
        }
    }

    record Orthographic(float shutterOpen, float shutterClose, float lensRadius,
                        float focalDistance, float frameAspectRatio, float[] screenWindow) implements Camera {

        public Orthographic {
            screenWindow = ParamReader.copy(screenWindow);
        }

        @Override
        public float[] screenWindow() {
            return ParamReader.copy(screenWindow);
        }
    }

    record Realistic(float shutterOpen, float shutterClose, String lensFile, float apertureDiameter,
                     float focusDistance, String aperture) implements Camera {}

    record Spherical(float shutterOpen, float shutterClose, String mapping) implements Camera {}

    static Camera create(String type, ParamList params) throws SceneLoadException {
        float shutterOpen = params.getFloat("shutteropen", 0.0f);
        float shutterClose = params.getFloat("shutterclose", 1.0f);
        // 0 means "derive from the film resolution".
        float frameAspectRatio = params.getFloat("frameaspectratio", 0.0f);
        float[] screenWindow = ParamReader.tuple(params, "screenwindow", 4, new float[0]);

        return switch (type) {
            case "perspective" -> new Perspective(shutterOpen, shutterClose,
                    params.getFloat("fov", 90.0f),
                    params.getFloat("lensradius", 0.0f),
                    params.getFloat("focaldistance", 1e6f),
                    frameAspectRatio, screenWindow);
            case "orthographic" -> new Orthographic(shutterOpen, shutterClose,
                    params.getFloat("lensradius", 0.0f),
                    params.getFloat("focaldistance", 1e6f),
                    frameAspectRatio, screenWindow);
            case "realistic" -> new Realistic(shutterOpen, shutterClose,
                    params.getString("lensfile", ""),
                    params.getFloat("aperturediameter", 1.0f),
                    params.getFloat("focusdistance", 10.0f),
                    params.getString("aperture", ""));
            case "spherical" -> new Spherical(shutterOpen, shutterClose,
                    params.getString("mapping", "equalarea"));
            default -> throw ParamReader.unsupported("camera", type);
        };
    }
}
