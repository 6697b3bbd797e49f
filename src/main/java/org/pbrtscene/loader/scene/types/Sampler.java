package org.pbrtscene.loader.scene.types;

import org.pbrtscene.loader.api.SceneLoadException;
import org.pbrtscene.loader.frontend.param.ParamList;

/**
 * The pixel sampler.
 *
 * @param xSamples Only meaningful for {@link Kind#STRATIFIED}.
 * @param ySamples Only meaningful for {@link Kind#STRATIFIED}.
 * @param jitter Only meaningful for {@link Kind#STRATIFIED}.
 */
public record Sampler(
        Kind kind,
        int pixelSamples,
        int seed,
        String randomization,
        int xSamples,
        int ySamples,
        boolean jitter
) {

    public enum Kind { HALTON, INDEPENDENT, PADDEDSOBOL, PMJ02BN, SOBOL, STRATIFIED, ZSOBOL }

    static Sampler create(String type, ParamList params) throws SceneLoadException {
        Kind kind;
        String defaultRandomization;
        switch (type) {
            case "halton" -> { kind = Kind.HALTON; defaultRandomization = "permutedigits"; }
            case "independent" -> { kind = Kind.INDEPENDENT; defaultRandomization = "none"; }
            case "paddedsobol" -> { kind = Kind.PADDEDSOBOL; defaultRandomization = "fastowen"; }
            case "pmj02bn" -> { kind = Kind.PMJ02BN; defaultRandomization = "none"; }
            case "sobol" -> { kind = Kind.SOBOL; defaultRandomization = "fastowen"; }
            case "stratified" -> { kind = Kind.STRATIFIED; defaultRandomization = "none"; }
            case "zsobol" -> { kind = Kind.ZSOBOL; defaultRandomization = "fastowen"; }
            default -> throw ParamReader.unsupported("sampler", type);
        }
        int xSamples = params.getInteger("xsamples", 4);
        int ySamples = params.getInteger("ysamples", 4);
        int defaultPixelSamples = kind == Kind.STRATIFIED ? xSamples * ySamples : 16;
        return new Sampler(kind,
                params.getInteger("pixelsamples", defaultPixelSamples),
                params.getInteger("seed", 0),
                params.getString("randomization", defaultRandomization),
                xSamples,
                ySamples,
                params.getBoolean("jitter", true));
    }
}
