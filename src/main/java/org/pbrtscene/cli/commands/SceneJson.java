package org.pbrtscene.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import org.joml.Matrix4fc;
import org.pbrtscene.loader.frontend.param.Spectrum;
import org.pbrtscene.loader.scene.types.Accelerator;
import org.pbrtscene.loader.scene.types.AreaLight;
import org.pbrtscene.loader.scene.types.Camera;
import org.pbrtscene.loader.scene.types.Light;
import org.pbrtscene.loader.scene.types.Material;
import org.pbrtscene.loader.scene.types.Medium;
import org.pbrtscene.loader.scene.types.ShadingInput;
import org.pbrtscene.loader.scene.types.Shape;
import org.pbrtscene.loader.scene.types.Texture;

import java.io.IOException;
import java.util.Set;

/**
 * Gson setup for dumping a {@link org.pbrtscene.loader.scene.Scene}. Write-only.
 */
final class SceneJson {

    private static final Set<Class<?>> TAGGED_ROOTS = Set.of(
            Camera.class, Accelerator.class, Shape.class, Light.class, AreaLight.class, Material.class,
            Medium.class, Texture.Kind.class, ShadingInput.class, Spectrum.class);

    private SceneJson() {}

    static Gson create() {
        return new GsonBuilder()
                .setPrettyPrinting()
                .serializeNulls()
                // Film.maxComponentValue defaults to Infinity
                .serializeSpecialFloatingPointValues()
                .registerTypeHierarchyAdapter(Matrix4fc.class, new MatrixAdapter())
                .registerTypeAdapterFactory(new KindTaggingFactory())
                .create();
    }

    /**
     * Writes a matrix as its 16 elements in column-major order.
     */
    private static final class MatrixAdapter extends TypeAdapter<Matrix4fc> {
        @Override
        public void write(JsonWriter out, Matrix4fc matrix) throws IOException {
            if (matrix == null) {
                out.nullValue();
                return;
            }
            out.beginArray();
            for (float v : matrix.get(new float[16])) {
                out.value(v);
            }
            out.endArray();
        }

        @Override
        public Matrix4fc read(JsonReader in) {
            throw new UnsupportedOperationException("Scene JSON is write-only");
        }
    }

    /**
     * Wraps values declared as one of the sealed entity interfaces as
     * {@code {"kind": "<record name>", "properties": {...}}} so the variant is not lost.
     */
    private static final class KindTaggingFactory implements TypeAdapterFactory {
        @Override
        public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
            if (!TAGGED_ROOTS.contains(type.getRawType())) {
                return null;
            }
            return new TypeAdapter<>() {
                @Override
                @SuppressWarnings("unchecked")
                public void write(JsonWriter out, T value) throws IOException {
                    if (value == null) {
                        out.nullValue();
                        return;
                    }
                    TypeAdapter<Object> delegate = (TypeAdapter<Object>) gson.getDelegateAdapter(
                            KindTaggingFactory.this, TypeToken.get(value.getClass()));
                    out.beginObject();
                    out.name("kind").value(value.getClass().getSimpleName());
                    out.name("properties");
                    delegate.write(out, value);
                    out.endObject();
                }

                @Override
                public T read(JsonReader in) {
                    throw new UnsupportedOperationException("Scene JSON is write-only");
                }
            };
        }
    }
}
