package org.pbrtscene.loader.scene;

import org.joml.Matrix4f;
import org.joml.Matrix4fc;
import org.pbrtscene.loader.scene.types.Shape;

/**
 * A shape placed in the world. Cross-references are indices into the {@link Scene} lists; each
 * may be null.
 */
public record ShapeEntity(
        Shape shape,
        Matrix4fc objectToWorld,
        boolean reverseOrientation,
        Integer materialIndex,
        Integer areaLightIndex,
        Integer interiorMediumIndex,
        Integer exteriorMediumIndex
) {

    public ShapeEntity {
        objectToWorld = new Matrix4f(objectToWorld);
    }
}
