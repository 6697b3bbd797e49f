package org.pbrtscene.loader.frontend.param;

import org.pbrtscene.loader.api.SceneErrorCode;
import org.pbrtscene.loader.api.SceneLoadException;
import org.pbrtscene.loader.api.SourceInfo;
import org.pbrtscene.loader.frontend.lexer.Token;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A single named, typed parameter, e.g. {@code "float radius" [ 2 ]}.
 * <p>
 * Values are appended while the parameter list is parsed. The accessors hand out copies, so
 * conversion code can keep what it reads without holding on to the parameter.
 */
public final class Param {

    private final String name;
    private final ParamType type;
    private final ParamValues values;

    /**
     * Creates an empty parameter.
     * @param name The parameter name.
     * @param type The declared type; it fixes the value container.
     */
    public Param(String name, ParamType type) {
        this.name = Objects.requireNonNull(name);
        this.type = Objects.requireNonNull(type);
        this.values = ParamValues.forType(type);
    }

    /**
     * Creates an empty parameter from a {@code "type name"} header.
     *
     * @param typeAndName The unquoted header text, e.g. {@code "float radius"}.
     * @param location Where the header was found, for error reporting. May be null.
     * @return The new parameter.
     * @throws SceneLoadException if the header is incomplete or the type is not in the vocabulary.
     */
    public static Param fromHeader(String typeAndName, SourceInfo location) throws SceneLoadException {
        String[] parts = typeAndName.trim().split("\\s+");
        if (parts.length < 2 || parts[0].isEmpty()) {
            throw new SceneLoadException(SceneErrorCode.INVALID_PARAM_NAME,
                    "Parameter header '" + typeAndName + "' must be \"type name\"", location);
        }
        ParamType type = ParamType.fromKeyword(parts[0]).orElseThrow(() -> new SceneLoadException(
                SceneErrorCode.INVALID_PARAM_TYPE, "Unknown parameter type '" + parts[0] + "'", location));
        return new Param(parts[1], type);
    }

    /**
     * Coerces a value token according to the declared type and appends it.
     * @param token The value token.
     * @throws SceneLoadException if the token cannot be coerced.
     */
    public void addValue(Token token) throws SceneLoadException {
        values.add(token);
    }

    public String name() {
        return name;
    }

    public ParamType type() {
        return type;
    }

    /**
     * @return The number of values held.
     */
    public int size() {
        return values.size();
    }

    public Optional<float[]> floats() {
        return values instanceof ParamValues.Floats f ? Optional.of(f.toArray()) : Optional.empty();
    }

    public Optional<int[]> integers() {
        return values instanceof ParamValues.Integers i ? Optional.of(i.toArray()) : Optional.empty();
    }

    public Optional<List<String>> strings() {
        return values instanceof ParamValues.Strings s ? Optional.of(s.toList()) : Optional.empty();
    }

    public Optional<boolean[]> booleans() {
        return values instanceof ParamValues.Booleans b ? Optional.of(b.toArray()) : Optional.empty();
    }

    /**
     * Interprets the parameter as a spectrum: an {@code rgb} parameter with exactly three floats, or
     * a {@code blackbody} parameter with at least one integer temperature.
     *
     * @return The spectrum, or empty for any other type or shape.
     */
    public Optional<Spectrum> spectrum() {
        if (type == ParamType.RGB) {
            return floats().filter(rgb -> rgb.length == 3)
                    .map(rgb -> new Spectrum.Rgb(rgb[0], rgb[1], rgb[2]));
        }
        if (type == ParamType.BLACKBODY) {
            return integers().filter(t -> t.length > 0)
                    .map(t -> new Spectrum.Blackbody(t[0]));
        }
        return Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Param other)) return false;
        return name.equals(other.name) && type == other.type && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, values);
    }

    @Override
    public String toString() {
        return "\"" + type.keyword() + " " + name + "\" " + values;
    }
}
