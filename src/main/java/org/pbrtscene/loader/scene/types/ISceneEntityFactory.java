package org.pbrtscene.loader.scene.types;

import org.pbrtscene.loader.api.SceneLoadException;
import org.pbrtscene.loader.frontend.param.ParamList;

import java.util.Map;

/**
 * Converts a type name plus a fully merged parameter table into a typed scene entity.
 * <p>
 * Implementations must be pure: they may not keep references to {@code params} or
 * {@code textures} after returning, and must copy out any values they store.
 */
public interface ISceneEntityFactory {

    Camera createCamera(String type, ParamList params) throws SceneLoadException;

    Film createFilm(String type, ParamList params) throws SceneLoadException;

    Sampler createSampler(String type, ParamList params) throws SceneLoadException;

    Integrator createIntegrator(String type, ParamList params) throws SceneLoadException;

    Accelerator createAccelerator(String type, ParamList params) throws SceneLoadException;

    Filter createFilter(String type, ParamList params) throws SceneLoadException;

    /**
     * @param textures Float texture name to index, for an {@code alpha} given as a texture.
     */
    Shape createShape(String type, ParamList params, Map<String, Integer> textures) throws SceneLoadException;

    Light createLight(String type, ParamList params) throws SceneLoadException;

    AreaLight createAreaLight(String type, ParamList params) throws SceneLoadException;

    /**
     * @param textures Texture name to index in the scene's texture list.
     */
    Material createMaterial(String type, ParamList params, Map<String, Integer> textures)
            throws SceneLoadException;

    /**
     * @param name The texture's name.
     * @param valueType {@code float} or {@code spectrum}.
     * @param textureClass The generator, e.g. {@code imagemap}.
     * @param textures Textures defined so far, for textures that reference other textures.
     */
    Texture createTexture(String name, String valueType, String textureClass, ParamList params,
                          Map<String, Integer> textures) throws SceneLoadException;

    Medium createMedium(String type, ParamList params) throws SceneLoadException;
}
