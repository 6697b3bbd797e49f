package org.pbrtscene.loader.scene.types;

import org.pbrtscene.loader.api.SceneLoadException;
import org.pbrtscene.loader.frontend.param.ParamList;

import java.util.List;
import java.util.Map;

/**
 * Surface materials. Inputs that the scene file leaves unspecified and that have no single
 * numeric default (for example a conductor's complex index of refraction) are null.
 */
public sealed interface Material {

    /**
     * Parameters every material accepts.
     *
     * @param displacement Displacement input, or null.
     * @param normalMap Image file name of a normal map, or empty.
     */
    record Surface(ShadingInput displacement, String normalMap) {}

    Surface surface();

    record Diffuse(Surface surface, ShadingInput reflectance) implements Material {}

    record Conductor(Surface surface, ShadingInput eta, ShadingInput k, ShadingInput reflectance,
                     ShadingInput uRoughness, ShadingInput vRoughness, boolean remapRoughness) implements Material {}

    record Dielectric(Surface surface, ShadingInput eta, ShadingInput uRoughness, ShadingInput vRoughness,
                      boolean remapRoughness) implements Material {}

    record ThinDielectric(Surface surface, ShadingInput eta) implements Material {}

    record DiffuseTransmission(Surface surface, ShadingInput reflectance, ShadingInput transmittance,
                               float scale) implements Material {}

    record CoatedDiffuse(Surface surface, ShadingInput reflectance, ShadingInput uRoughness,
                         ShadingInput vRoughness, ShadingInput thickness, ShadingInput eta, ShadingInput albedo,
                         ShadingInput g, int maxDepth, int nSamples, boolean remapRoughness) implements Material {}

    record CoatedConductor(Surface surface, ShadingInput interfaceURoughness, ShadingInput interfaceVRoughness,
                           ShadingInput interfaceEta, ShadingInput thickness, ShadingInput conductorEta,
                           ShadingInput conductorK, ShadingInput conductorURoughness,
                           ShadingInput conductorVRoughness, ShadingInput reflectance, ShadingInput albedo,
                           ShadingInput g, int maxDepth, int nSamples, boolean remapRoughness) implements Material {}

    record Measured(Surface surface, String fileName) implements Material {}

    record Subsurface(Surface surface, String coefficients, ShadingInput sigmaA, ShadingInput sigmaS,
                      ShadingInput reflectance, ShadingInput meanFreePath, float scale, float eta, float g,
                      ShadingInput uRoughness, ShadingInput vRoughness, boolean remapRoughness) implements Material {}

    record Hair(Surface surface, ShadingInput sigmaA, ShadingInput color, ShadingInput eumelanin,
                ShadingInput pheomelanin, ShadingInput eta, ShadingInput betaM, ShadingInput betaN,
                ShadingInput alpha) implements Material {}

    /**
     * Blends two named materials.
     * @param materials The names of the two materials, resolved by the renderer.
     */
    record Mix(Surface surface, List<String> materials, ShadingInput amount) implements Material {

        public Mix {
            materials = List.copyOf(materials);
        }
    }

    /** Marks a boundary between two media without scattering. */
    record Interface(Surface surface) implements Material {}

    static Material create(String type, ParamList params, Map<String, Integer> textures) throws SceneLoadException {
        ParamReader.Inputs in = new ParamReader.Inputs(params, textures);
        Surface surface = new Surface(in.get("displacement", null), params.getString("normalmap", ""));
        boolean remap = params.getBoolean("remaproughness", true);
        switch (type) {
            case "diffuse":
                return new Diffuse(surface, in.get("reflectance", 0.5f));
            case "conductor":
                return new Conductor(surface, in.get("eta", null), in.get("k", null), in.get("reflectance", null),
                        in.roughness("uroughness"), in.roughness("vroughness"), remap);
            case "dielectric":
                return new Dielectric(surface, in.get("eta", 1.5f),
                        in.roughness("uroughness"), in.roughness("vroughness"), remap);
            case "thindielectric":
                return new ThinDielectric(surface, in.get("eta", 1.5f));
            case "diffusetransmission":
                return new DiffuseTransmission(surface, in.get("reflectance", 0.25f), in.get("transmittance", 0.25f),
                        params.getFloat("scale", 1.0f));
            case "coateddiffuse":
                return new CoatedDiffuse(surface, in.get("reflectance", 0.5f),
                        in.roughness("uroughness"), in.roughness("vroughness"),
                        in.get("thickness", 0.01f), in.get("eta", 1.5f), in.get("albedo", 0.0f), in.get("g", 0.0f),
                        params.getInteger("maxdepth", 10), params.getInteger("nsamples", 1), remap);
            case "coatedconductor":
                return new CoatedConductor(surface,
                        in.roughness("interface.uroughness"), in.roughness("interface.vroughness"),
                        in.get("interface.eta", 1.5f), in.get("thickness", 0.01f),
                        in.get("conductor.eta", null), in.get("conductor.k", null),
                        in.roughness("conductor.uroughness"), in.roughness("conductor.vroughness"),
                        in.get("reflectance", null), in.get("albedo", 0.0f), in.get("g", 0.0f),
                        params.getInteger("maxdepth", 10), params.getInteger("nsamples", 1), remap);
            case "measured":
                return new Measured(surface, params.getString("filename", ""));
            case "subsurface":
                return new Subsurface(surface, params.getString("name", ""),
                        in.get("sigma_a", null), in.get("sigma_s", null), in.get("reflectance", null),
                        in.get("mfp", null), params.getFloat("scale", 1.0f), params.getFloat("eta", 1.33f),
                        params.getFloat("g", 0.0f), in.roughness("uroughness"), in.roughness("vroughness"), remap);
            case "hair":
                return new Hair(surface, in.get("sigma_a", null), in.get("color", null),
                        in.get("eumelanin", null), in.get("pheomelanin", null), in.get("eta", 1.55f),
                        in.get("beta_m", 0.3f), in.get("beta_n", 0.3f), in.get("alpha", 2.0f));
            case "mix": {
                List<String> materials = ParamReader.stringList(params, "materials");
                if (materials.size() != 2) {
                    throw ParamReader.invalid("materials", "expected exactly two material names, got "
                            + materials.size());
                }
                return new Mix(surface, materials, in.get("amount", 0.5f));
            }
            case "interface":
                return new Interface(surface);
            default:
                throw ParamReader.unsupported("material", type);
        }
    }
}
