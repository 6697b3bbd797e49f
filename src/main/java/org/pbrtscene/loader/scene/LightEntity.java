package org.pbrtscene.loader.scene;

import org.joml.Matrix4f;
import org.joml.Matrix4fc;
import org.pbrtscene.loader.scene.types.Light;

public record LightEntity(Light light, Matrix4fc lightToWorld, Integer mediumIndex) {

    public LightEntity {
        lightToWorld = new Matrix4f(lightToWorld);
    }
}
