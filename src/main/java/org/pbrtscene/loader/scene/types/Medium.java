package org.pbrtscene.loader.scene.types;

import org.pbrtscene.loader.api.SceneLoadException;
import org.pbrtscene.loader.frontend.param.ParamList;
import org.pbrtscene.loader.frontend.param.Spectrum;

/**
 * Participating media. Absent absorption and scattering spectra are null.
 */
public sealed interface Medium {

    float scale();

    record Homogeneous(float scale, Spectrum sigmaA, Spectrum sigmaS, Spectrum emission, float g,
                       String preset) implements Medium {}

    /**
     * @param density Row-major {@code nx * ny * nz} samples.
     */
    record UniformGrid(float scale, Spectrum sigmaA, Spectrum sigmaS, float g, int nx, int ny, int nz,
                       float[] density, float[] p0, float[] p1) implements Medium {

        public UniformGrid {
            density = ParamReader.copy(density);
            p0 = ParamReader.copy(p0);
            p1 = ParamReader.copy(p1);
        }

        @Override
        public float[] density() {
            return ParamReader.copy(density);
        }

        @Override
        public float[] p0() {
            return ParamReader.copy(p0);
        }

        @Override
        public float[] p1() {
            return ParamReader.copy(p1);
        }
    }

    record RgbGrid(float scale, float g, int nx, int ny, int nz, float[] sigmaA, float[] sigmaS,
                   float[] p0, float[] p1) implements Medium {

        public RgbGrid {
            sigmaA = ParamReader.copy(sigmaA);
            sigmaS = ParamReader.copy(sigmaS);
            p0 = ParamReader.copy(p0);
            p1 = ParamReader.copy(p1);
        }

        @Override
        public float[] sigmaA() {
            return ParamReader.copy(sigmaA);
        }

        @Override
        public float[] sigmaS() {
            return ParamReader.copy(sigmaS);
        }

        @Override
        public float[] p0() {
            return ParamReader.copy(p0);
        }

        @Override
        public float[] p1() {
            return ParamReader.copy(p1);
        }
    }

    record Cloud(float scale, Spectrum sigmaA, Spectrum sigmaS, float g, float density, float wispiness,
                 float frequency, float[] p0, float[] p1) implements Medium {

        public Cloud {
            p0 = ParamReader.copy(p0);
            p1 = ParamReader.copy(p1);
        }

        @Override
        public float[] p0() {
            return ParamReader.copy(p0);
        }

        @Override
        public float[] p1() {
            return ParamReader.copy(p1);
        }
    }

    record NanoVdb(float scale, Spectrum sigmaA, Spectrum sigmaS, float g, String fileName) implements Medium {}

    static Medium create(String type, ParamList params) throws SceneLoadException {
        float scale = params.getFloat("scale", 1.0f);
        float g = params.getFloat("g", 0.0f);
        float[] p0 = ParamReader.tuple(params, "p0", 3, new float[]{0, 0, 0});
        float[] p1 = ParamReader.tuple(params, "p1", 3, new float[]{1, 1, 1});
        switch (type) {
            case "homogeneous":
                return new Homogeneous(scale,
                        ParamReader.spectrum(params, "sigma_a"),
                        ParamReader.spectrum(params, "sigma_s"),
                        ParamReader.spectrum(params, "Le"),
                        g,
                        params.getString("preset", ""));
            case "uniformgrid": {
                int nx = params.getInteger("nx", 1);
                int ny = params.getInteger("ny", 1);
                int nz = params.getInteger("nz", 1);
                return new UniformGrid(scale,
                        ParamReader.spectrum(params, "sigma_a"),
                        ParamReader.spectrum(params, "sigma_s"),
                        g, nx, ny, nz,
                        grid(params, "density", nx * ny * nz), p0, p1);
            }
            case "rgbgrid": {
                int nx = params.getInteger("nx", 1);
                int ny = params.getInteger("ny", 1);
                int nz = params.getInteger("nz", 1);
                return new RgbGrid(scale, g, nx, ny, nz,
                        grid(params, "sigma_a", 3 * nx * ny * nz),
                        grid(params, "sigma_s", 3 * nx * ny * nz), p0, p1);
            }
            case "cloud":
                return new Cloud(scale,
                        ParamReader.spectrum(params, "sigma_a"),
                        ParamReader.spectrum(params, "sigma_s"),
                        g,
                        params.getFloat("density", 1.0f),
                        params.getFloat("wispiness", 1.0f),
                        params.getFloat("frequency", 5.0f),
                        p0, p1);
            case "nanovdb":
                return new NanoVdb(scale,
                        ParamReader.spectrum(params, "sigma_a"),
                        ParamReader.spectrum(params, "sigma_s"),
                        g,
                        params.getString("filename", ""));
            default:
                throw ParamReader.unsupported("medium", type);
        }
    }

    private static float[] grid(ParamList params, String name, int expected) throws SceneLoadException {
        float[] values = ParamReader.floatArray(params, name);
        if (values.length != 0 && values.length != expected) {
            throw ParamReader.invalid(name, "expected " + expected + " values, got " + values.length);
        }
        return values;
    }
}
