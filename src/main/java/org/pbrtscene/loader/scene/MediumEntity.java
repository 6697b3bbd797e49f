package org.pbrtscene.loader.scene;

import org.joml.Matrix4f;
import org.joml.Matrix4fc;
import org.pbrtscene.loader.scene.types.Medium;

public record MediumEntity(String name, Medium medium, Matrix4fc mediumToWorld) {

    public MediumEntity {
        mediumToWorld = new Matrix4f(mediumToWorld);
    }
}
