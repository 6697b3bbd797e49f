package org.pbrtscene.loader.scene;

import org.joml.Matrix4f;
import org.joml.Matrix4fc;
import org.pbrtscene.loader.scene.types.Camera;

/**
 * @param cameraToWorld The inverse of the transform active at the {@code Camera} directive.
 * @param mediumIndex The medium the camera sits in, or null.
 */
public record CameraEntity(Camera camera, Matrix4fc cameraToWorld, Integer mediumIndex) {

    public CameraEntity {
        cameraToWorld = new Matrix4f(cameraToWorld);
    }
}
