package org.pbrtscene.loader.scene;

import org.joml.Matrix4f;
import org.joml.Vector3f;
import org.pbrtscene.loader.api.SceneErrorCode;
import org.pbrtscene.loader.api.SceneLoadException;

/**
 * Matrix constructors for the transform directives.
 * All returned matrices are fresh instances owned by the caller.
 */
public final class Transforms {

    private Transforms() {}

    /**
     * @param m 16 floats in column-major order.
     */
    public static Matrix4f fromColumnMajor(float[] m) {
        return new Matrix4f().set(m);
    }

    /**
     * @param angleDegrees The rotation angle in degrees.
     * @throws SceneLoadException if the axis has zero length.
     */
    public static Matrix4f rotation(float angleDegrees, float x, float y, float z) throws SceneLoadException {
        Vector3f axis = new Vector3f(x, y, z);
        if (axis.lengthSquared() == 0.0f) {
            throw new SceneLoadException(SceneErrorCode.INVALID_PARAMETER_VALUE, "Rotation axis has zero length");
        }
        axis.normalize();
        return new Matrix4f().rotation((float) Math.toRadians(angleDegrees), axis);
    }

    /**
     * Builds the world-to-camera matrix of a camera at {@code eye} looking at {@code look}.
     *
     * @throws SceneLoadException if {@code eye} equals {@code look} or {@code up} is parallel to the
     *         viewing direction.
     */
    public static Matrix4f lookAt(Vector3f eye, Vector3f look, Vector3f up) throws SceneLoadException {
        Vector3f dir = new Vector3f(look).sub(eye);
        if (dir.lengthSquared() == 0.0f) {
            throw new SceneLoadException(SceneErrorCode.INVALID_PARAMETER_VALUE,
                    "LookAt eye and look points are the same");
        }
        dir.normalize();
        Vector3f right = new Vector3f(up).normalize().cross(dir);
        if (right.lengthSquared() == 0.0f) {
            throw new SceneLoadException(SceneErrorCode.INVALID_PARAMETER_VALUE,
                    "LookAt up vector and viewing direction are parallel");
        }
        right.normalize();
        Vector3f newUp = new Vector3f(dir).cross(right);

        // columns: right, up, direction, eye
        Matrix4f cameraToWorld = new Matrix4f(
                right.x, right.y, right.z, 0.0f,
                newUp.x, newUp.y, newUp.z, 0.0f,
                dir.x, dir.y, dir.z, 0.0f,
                eye.x, eye.y, eye.z, 1.0f);
        return cameraToWorld.invert();
    }
}
