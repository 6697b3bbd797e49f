package org.pbrtscene.loader.frontend.param;

/**
 * A spectral value as written in a scene file: either an RGB triple or a blackbody temperature.
 */
public sealed interface Spectrum permits Spectrum.Rgb, Spectrum.Blackbody {

    /**
     * {@code "rgb L" [ r g b ]}
     */
    record Rgb(float r, float g, float b) implements Spectrum {
    }

    /**
     * {@code "blackbody L" 3000}
     *
     * @param temperature The temperature in Kelvin.
     */
    record Blackbody(int temperature) implements Spectrum {
    }
}
