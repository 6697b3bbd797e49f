package org.pbrtscene.loader.scene;

import org.joml.Matrix4f;
import org.joml.Matrix4fc;
import org.pbrtscene.loader.scene.types.Texture;

public record TextureEntity(Texture texture, Matrix4fc textureToWorld) {

    public TextureEntity {
        textureToWorld = new Matrix4f(textureToWorld);
    }
}
