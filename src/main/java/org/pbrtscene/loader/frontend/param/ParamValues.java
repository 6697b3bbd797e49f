package org.pbrtscene.loader.frontend.param;

import org.pbrtscene.loader.api.SceneLoadException;
import org.pbrtscene.loader.frontend.lexer.Token;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A type-homogeneous container of parameter values. The variant is chosen once, from the declared
 * {@link ParamType}, and never changes.
 */
public abstract sealed class ParamValues
        permits ParamValues.Floats, ParamValues.Integers, ParamValues.Strings, ParamValues.Booleans {

    /**
     * Creates the empty container that matches a parameter type.
     * @param type The declared type.
     * @return A new, empty container.
     */
    static ParamValues forType(ParamType type) {
        return switch (type.valueKind()) {
            case FLOATS -> new Floats();
            case INTEGERS -> new Integers();
            case STRINGS -> new Strings();
            case BOOLEANS -> new Booleans();
        };
    }

    /**
     * Coerces a token and appends it.
     * @param token The value token.
     * @throws SceneLoadException if the token cannot be coerced to this container's element type.
     */
    abstract void add(Token token) throws SceneLoadException;

    /**
     * @return The number of values.
     */
    public abstract int size();

    public static final class Floats extends ParamValues {
        private float[] data = new float[4];
        private int size;

        @Override
        void add(Token token) throws SceneLoadException {
            float value = token.parseFloat();
            if (size == data.length) {
                data = Arrays.copyOf(data, size * 2);
            }
            data[size++] = value;
        }

        @Override
        public int size() {
            return size;
        }

        public float[] toArray() {
            return Arrays.copyOf(data, size);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Floats other && Arrays.equals(toArray(), other.toArray());
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(toArray());
        }

        @Override
        public String toString() {
            return Arrays.toString(toArray());
        }
    }

    public static final class Integers extends ParamValues {
        private int[] data = new int[4];
        private int size;

        @Override
        void add(Token token) throws SceneLoadException {
            int value = token.parseInt();
            if (size == data.length) {
                data = Arrays.copyOf(data, size * 2);
            }
            data[size++] = value;
        }

        @Override
        public int size() {
            return size;
        }

        public int[] toArray() {
            return Arrays.copyOf(data, size);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Integers other && Arrays.equals(toArray(), other.toArray());
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(toArray());
        }

        @Override
        public String toString() {
            return Arrays.toString(toArray());
        }
    }

    public static final class Strings extends ParamValues {
        private final List<String> data = new ArrayList<>();

        @Override
        void add(Token token) throws SceneLoadException {
            data.add(token.unquote());
        }

        @Override
        public int size() {
            return data.size();
        }

        public List<String> toList() {
            return Collections.unmodifiableList(data);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Strings other && data.equals(other.data);
        }

        @Override
        public int hashCode() {
            return data.hashCode();
        }

        @Override
        public String toString() {
            return data.toString();
        }
    }

    public static final class Booleans extends ParamValues {
        private boolean[] data = new boolean[2];
        private int size;

        @Override
        void add(Token token) throws SceneLoadException {
            boolean value = token.parseBoolean();
            if (size == data.length) {
                data = Arrays.copyOf(data, size * 2);
            }
            data[size++] = value;
        }

        @Override
        public int size() {
            return size;
        }

        public boolean[] toArray() {
            return Arrays.copyOf(data, size);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Booleans other && Arrays.equals(toArray(), other.toArray());
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(toArray());
        }

        @Override
        public String toString() {
            return Arrays.toString(toArray());
        }
    }
}
