package org.pbrtscene.loader.scene.types;

import org.pbrtscene.loader.api.SceneLoadException;
import org.pbrtscene.loader.frontend.param.ParamList;

import java.util.Map;

/**
 * Builds entities with the scene format's documented defaults for every omitted parameter.
 * Unknown type names raise {@link org.pbrtscene.loader.api.SceneErrorCode#UNSUPPORTED_TYPE}.
 */
public class DefaultSceneEntityFactory implements ISceneEntityFactory {

    @Override
    public Camera createCamera(String type, ParamList params) throws SceneLoadException {
        return Camera.create(type, params);
    }

    @Override
    public Film createFilm(String type, ParamList params) throws SceneLoadException {
        return Film.create(type, params);
    }

    @Override
    public Sampler createSampler(String type, ParamList params) throws SceneLoadException {
        return Sampler.create(type, params);
    }

    @Override
    public Integrator createIntegrator(String type, ParamList params) throws SceneLoadException {
        return Integrator.create(type, params);
    }

    @Override
    public Accelerator createAccelerator(String type, ParamList params) throws SceneLoadException {
        return Accelerator.create(type, params);
    }

    @Override
    public Filter createFilter(String type, ParamList params) throws SceneLoadException {
        return Filter.create(type, params);
    }

    @Override
    public Shape createShape(String type, ParamList params, Map<String, Integer> textures)
            throws SceneLoadException {
        return Shape.create(type, params, textures);
    }

    @Override
    public Light createLight(String type, ParamList params) throws SceneLoadException {
        return Light.create(type, params);
    }

    @Override
    public AreaLight createAreaLight(String type, ParamList params) throws SceneLoadException {
        return AreaLight.create(type, params);
    }

    @Override
    public Material createMaterial(String type, ParamList params, Map<String, Integer> textures)
            throws SceneLoadException {
        return Material.create(type, params, textures);
    }

    @Override
    public Texture createTexture(String name, String valueType, String textureClass, ParamList params,
                                 Map<String, Integer> textures) throws SceneLoadException {
        return Texture.create(name, valueType, textureClass, params, textures);
    }

    @Override
    public Medium createMedium(String type, ParamList params) throws SceneLoadException {
        return Medium.create(type, params);
    }
}
