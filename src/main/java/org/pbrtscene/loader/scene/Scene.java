package org.pbrtscene.loader.scene;

import org.pbrtscene.loader.scene.types.Accelerator;
import org.pbrtscene.loader.scene.types.AreaLight;
import org.pbrtscene.loader.scene.types.Film;
import org.pbrtscene.loader.scene.types.Filter;
import org.pbrtscene.loader.scene.types.Integrator;
import org.pbrtscene.loader.scene.types.Material;
import org.pbrtscene.loader.scene.types.Sampler;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The result of loading a scene file.
 * <p>
 * Header entities are null when the file does not define them. Shapes, the camera and lights refer
 * to materials, area lights and media by index into the lists held here.
 */
public record Scene(
        Options options,
        CameraEntity camera,
        Film film,
        Sampler sampler,
        Integrator integrator,
        Accelerator accelerator,
        Filter filter,
        List<TextureEntity> textures,
        List<Material> materials,
        List<LightEntity> lights,
        List<AreaLight> areaLights,
        List<MediumEntity> mediums,
        List<ShapeEntity> shapes,
        Map<String, Integer> namedTextures,
        Map<String, Integer> namedMaterials,
        Map<String, Integer> namedMediums
) {

    public Scene {
        textures = List.copyOf(textures);
        materials = List.copyOf(materials);
        lights = List.copyOf(lights);
        areaLights = List.copyOf(areaLights);
        mediums = List.copyOf(mediums);
        shapes = List.copyOf(shapes);
        namedTextures = Map.copyOf(namedTextures);
        namedMaterials = Map.copyOf(namedMaterials);
        namedMediums = Map.copyOf(namedMediums);
    }

    public Optional<CameraEntity> findCamera() {
        return Optional.ofNullable(camera);
    }

    public Optional<Film> findFilm() {
        return Optional.ofNullable(film);
    }

    public Optional<Sampler> findSampler() {
        return Optional.ofNullable(sampler);
    }

    public Optional<Integrator> findIntegrator() {
        return Optional.ofNullable(integrator);
    }

    public Optional<Accelerator> findAccelerator() {
        return Optional.ofNullable(accelerator);
    }

    public Optional<Filter> findFilter() {
        return Optional.ofNullable(filter);
    }

    /**
     * @return A one-line summary of the list sizes, as logged after a load.
     */
    public String summary() {
        return String.format("%d shapes, %d lights, %d area lights, %d materials, %d textures, %d mediums%s",
                shapes.size(), lights.size(), areaLights.size(), materials.size(), textures.size(), mediums.size(),
                camera == null ? ", no camera" : "");
    }
}
