package org.pbrtscene.loader.scene.types;

import org.pbrtscene.loader.frontend.param.Spectrum;

/**
 * A material or texture input that can be a constant, a spectrum, or a texture reference.
 */
public sealed interface ShadingInput {

    /** A constant scalar. */
    record Constant(float value) implements ShadingInput {}

    /** An rgb or blackbody value. */
    record Color(Spectrum spectrum) implements ShadingInput {}

    /** A sampled spectrum given as (wavelength, value) pairs. */
    record Sampled(float[] lambdaValuePairs) implements ShadingInput {

        public Sampled {
            lambdaValuePairs = ParamReader.copy(lambdaValuePairs);
        }

        @Override
        public float[] lambdaValuePairs() {
            return ParamReader.copy(lambdaValuePairs);
        }
    }

    /**
     * A named texture, resolved to its index in the scene's texture list.
     */
    record TextureRef(String name, int index) implements ShadingInput {}
}
