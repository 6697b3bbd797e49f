package org.pbrtscene.loader.scene.types;

import org.pbrtscene.loader.api.SceneLoadException;
import org.pbrtscene.loader.frontend.param.ParamList;

import java.util.Map;

/**
 * Geometric shapes. Every shape carries an alpha input used for cut-outs.
 */
public sealed interface Shape {

    ShadingInput alpha();

    record Sphere(ShadingInput alpha, float radius, float zMin, float zMax, float phiMax) implements Shape {}

    record Cylinder(ShadingInput alpha, float radius, float zMin, float zMax, float phiMax) implements Shape {}

    record Disk(ShadingInput alpha, float height, float radius, float innerRadius, float phiMax) implements Shape {}

    /**
     * An indexed triangle mesh. Per-vertex arrays other than {@code positions} may be empty.
     */
    record TriangleMesh(ShadingInput alpha, float[] positions, int[] indices, float[] normals,
                        float[] tangents, float[] uvs, int[] faceIndices) implements Shape {

        public TriangleMesh {
            positions = ParamReader.copy(positions);
            indices = ParamReader.copy(indices);
            normals = ParamReader.copy(normals);
            tangents = ParamReader.copy(tangents);
            uvs = ParamReader.copy(uvs);
            faceIndices = ParamReader.copy(faceIndices);
        }

        @Override
        public float[] positions() {
            return ParamReader.copy(positions);
        }

        @Override
        public int[] indices() {
            return ParamReader.copy(indices);
        }

        @Override
        public float[] normals() {
            return ParamReader.copy(normals);
        }

        @Override
        public float[] tangents() {
            return ParamReader.copy(tangents);
        }

        @Override
        public float[] uvs() {
            return ParamReader.copy(uvs);
        }

        @Override
        public int[] faceIndices() {
            return ParamReader.copy(faceIndices);
        }
    }

    record BilinearMesh(ShadingInput alpha, float[] positions, int[] indices, float[] normals,
                        float[] uvs, int[] faceIndices) implements Shape {

        public BilinearMesh {
            positions = ParamReader.copy(positions);
            indices = ParamReader.copy(indices);
            normals = ParamReader.copy(normals);
            uvs = ParamReader.copy(uvs);
            faceIndices = ParamReader.copy(faceIndices);
        }

        @Override
        public float[] positions() {
            return ParamReader.copy(positions);
        }

        @Override
        public int[] indices() {
            return ParamReader.copy(indices);
        }

        @Override
        public float[] normals() {
            return ParamReader.copy(normals);
        }

        @Override
        public float[] uvs() {
            return ParamReader.copy(uvs);
        }

        @Override
        public int[] faceIndices() {
            return ParamReader.copy(faceIndices);
        }
    }

    record LoopSubdiv(ShadingInput alpha, int levels, float[] positions, int[] indices) implements Shape {

        public LoopSubdiv {
            positions = ParamReader.copy(positions);
            indices = ParamReader.copy(indices);
        }

        @Override
        public float[] positions() {
            return ParamReader.copy(positions);
        }

        @Override
        public int[] indices() {
            return ParamReader.copy(indices);
        }
    }

    record PlyMesh(ShadingInput alpha, String fileName, String displacementTexture, float edgeLength)
            implements Shape {}

    record Curve(ShadingInput alpha, float[] controlPoints, String basis, int degree, String curveType,
                 float width0, float width1, int splitDepth) implements Shape {

        public Curve {
            controlPoints = ParamReader.copy(controlPoints);
        }

        @Override
        public float[] controlPoints() {
            return ParamReader.copy(controlPoints);
        }
    }

    static Shape create(String type, ParamList params, Map<String, Integer> textures) throws SceneLoadException {
        ShadingInput alpha = ParamReader.input(params, "alpha", new ShadingInput.Constant(1.0f), textures);
        switch (type) {
            case "sphere": {
                float radius = params.getFloat("radius", 1.0f);
                return new Sphere(alpha, radius,
                        params.getFloat("zmin", -radius),
                        params.getFloat("zmax", radius),
                        params.getFloat("phimax", 360.0f));
            }
            case "cylinder":
                return new Cylinder(alpha,
                        params.getFloat("radius", 1.0f),
                        params.getFloat("zmin", -1.0f),
                        params.getFloat("zmax", 1.0f),
                        params.getFloat("phimax", 360.0f));
            case "disk":
                return new Disk(alpha,
                        params.getFloat("height", 0.0f),
                        params.getFloat("radius", 1.0f),
                        params.getFloat("innerradius", 0.0f),
                        params.getFloat("phimax", 360.0f));
            case "trianglemesh":
                return triangleMesh(alpha, params);
            case "bilinearmesh":
                return bilinearMesh(alpha, params);
            case "loopsubdiv": {
                float[] positions = positions(params);
                int[] indices = indices(params, positions.length / 3, 3, "loopsubdiv");
                return new LoopSubdiv(alpha, params.getInteger("levels", 3), positions, indices);
            }
            case "plymesh":
                return new PlyMesh(alpha,
                        params.getString("filename", ""),
                        params.getString("displacement", ""),
                        params.getFloat("edgelength", 1.0f));
            case "curve": {
                float width = params.getFloat("width", 1.0f);
                return new Curve(alpha,
                        ParamReader.floatArray(params, "P"),
                        params.getString("basis", "bezier"),
                        params.getInteger("degree", 3),
                        params.getString("type", "flat"),
                        params.getFloat("width0", width),
                        params.getFloat("width1", width),
                        params.getInteger("splitdepth", 3));
            }
            default:
                throw ParamReader.unsupported("shape", type);
        }
    }

    private static TriangleMesh triangleMesh(ShadingInput alpha, ParamList params) throws SceneLoadException {
        float[] positions = positions(params);
        int vertexCount = positions.length / 3;
        int[] indices;
        if (!params.contains("indices") && vertexCount == 3) {
            indices = new int[]{0, 1, 2};
        } else {
            indices = indices(params, vertexCount, 3, "trianglemesh");
        }
        float[] normals = perVertex(params, "N", 3, vertexCount);
        float[] tangents = perVertex(params, "S", 3, vertexCount);
        float[] uvs = perVertex(params, "uv", 2, vertexCount);
        int[] faceIndices = ParamReader.intArray(params, "faceIndices");
        if (faceIndices.length != 0 && faceIndices.length != indices.length / 3) {
            throw ParamReader.invalid("faceIndices", "expected one entry per triangle");
        }
        return new TriangleMesh(alpha, positions, indices, normals, tangents, uvs, faceIndices);
    }

    private static BilinearMesh bilinearMesh(ShadingInput alpha, ParamList params) throws SceneLoadException {
        float[] positions = positions(params);
        int vertexCount = positions.length / 3;
        int[] indices;
        if (!params.contains("indices") && vertexCount == 4) {
            indices = new int[]{0, 1, 2, 3};
        } else {
            indices = indices(params, vertexCount, 4, "bilinearmesh");
        }
        float[] normals = perVertex(params, "N", 3, vertexCount);
        float[] uvs = perVertex(params, "uv", 2, vertexCount);
        int[] faceIndices = ParamReader.intArray(params, "faceIndices");
        if (faceIndices.length != 0 && faceIndices.length != indices.length / 4) {
            throw ParamReader.invalid("faceIndices", "expected one entry per patch");
        }
        return new BilinearMesh(alpha, positions, indices, normals, uvs, faceIndices);
    }

    private static float[] positions(ParamList params) throws SceneLoadException {
        float[] positions = ParamReader.floatArray(params, "P");
        if (positions.length == 0) {
            throw ParamReader.invalid("P", "vertex positions are required");
        }
        if (positions.length % 3 != 0) {
            throw ParamReader.invalid("P", "length " + positions.length + " is not a multiple of 3");
        }
        return positions;
    }

    private static int[] indices(ParamList params, int vertexCount, int perFace, String shape)
            throws SceneLoadException {
        int[] indices = ParamReader.intArray(params, "indices");
        if (indices.length == 0) {
            throw ParamReader.invalid("indices", "required for a " + shape + " with " + vertexCount + " vertices");
        }
        if (indices.length % perFace != 0) {
            throw ParamReader.invalid("indices", "length " + indices.length + " is not a multiple of " + perFace);
        }
        for (int index : indices) {
            if (index < 0 || index >= vertexCount) {
                throw ParamReader.invalid("indices", "index " + index + " out of range [0, " + vertexCount + ")");
            }
        }
        return indices;
    }

    private static float[] perVertex(ParamList params, String name, int arity, int vertexCount)
            throws SceneLoadException {
        float[] values = ParamReader.floatArray(params, name);
        if (values.length != 0 && values.length != arity * vertexCount) {
            throw ParamReader.invalid(name, "expected " + arity * vertexCount + " values, got " + values.length);
        }
        return values;
    }
}
