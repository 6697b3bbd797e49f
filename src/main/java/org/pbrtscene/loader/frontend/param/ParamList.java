package org.pbrtscene.loader.frontend.param;

import org.pbrtscene.loader.api.SceneErrorCode;
import org.pbrtscene.loader.api.SceneLoadException;
import org.pbrtscene.loader.api.SourceInfo;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A name-keyed table of parameters. Insertion order is irrelevant.
 * <p>
 * {@link #add(Param, SourceInfo)} rejects duplicate names; {@link #merge(ParamList)} overwrites
 * entries of the same name and is used to apply attribute-scope inheritance.
 */
public final class ParamList {

    private final Map<String, Param> params = new HashMap<>();

    /**
     * Adds a parameter to the table.
     * @param param The parameter to add.
     * @param location Where the parameter was declared, for error reporting. May be null.
     * @throws SceneLoadException with {@link SceneErrorCode#DUPLICATE_PARAMETER} if the name already exists.
     */
    public void add(Param param, SourceInfo location) throws SceneLoadException {
        if (params.putIfAbsent(param.name(), param) != null) {
            throw new SceneLoadException(SceneErrorCode.DUPLICATE_PARAMETER,
                    "Duplicate parameter '" + param.name() + "'", location);
        }
    }

    /**
     * Inserts every entry of {@code other}, overwriting entries of the same name.
     * @param other The table whose entries win.
     */
    public void merge(ParamList other) {
        params.putAll(other.params);
    }

    /**
     * @return A shallow copy of this table. Parameters themselves are not modified after parsing.
     */
    public ParamList copy() {
        ParamList copy = new ParamList();
        copy.params.putAll(params);
        return copy;
    }

    public Optional<Param> get(String name) {
        return Optional.ofNullable(params.get(name));
    }

    public boolean contains(String name) {
        return params.containsKey(name);
    }

    public int size() {
        return params.size();
    }

    public boolean isEmpty() {
        return params.isEmpty();
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(params.keySet());
    }

    public Collection<Param> params() {
        return Collections.unmodifiableCollection(params.values());
    }

    public Optional<float[]> floats(String name) {
        return get(name).flatMap(Param::floats);
    }

    public Optional<int[]> integers(String name) {
        return get(name).flatMap(Param::integers);
    }

    public Optional<List<String>> strings(String name) {
        return get(name).flatMap(Param::strings);
    }

    public Optional<boolean[]> booleans(String name) {
        return get(name).flatMap(Param::booleans);
    }

    /**
     * @return The first float of the named parameter, or {@code defaultValue}.
     */
    public float getFloat(String name, float defaultValue) {
        return floats(name).filter(v -> v.length > 0).map(v -> v[0]).orElse(defaultValue);
    }

    /**
     * @return The first integer of the named parameter, or {@code defaultValue}.
     */
    public int getInteger(String name, int defaultValue) {
        return integers(name).filter(v -> v.length > 0).map(v -> v[0]).orElse(defaultValue);
    }

    /**
     * @return The first string of the named parameter, or empty.
     */
    public Optional<String> getString(String name) {
        return strings(name).filter(v -> !v.isEmpty()).map(v -> v.get(0));
    }

    /**
     * @return The first string of the named parameter, or {@code defaultValue}.
     */
    public String getString(String name, String defaultValue) {
        return getString(name).orElse(defaultValue);
    }

    /**
     * @return The first boolean of the named parameter, or {@code defaultValue}.
     */
    public boolean getBoolean(String name, boolean defaultValue) {
        return booleans(name).filter(v -> v.length > 0).map(v -> v[0]).orElse(defaultValue);
    }

    /**
     * @return The named parameter as an RGB or blackbody spectrum, or empty.
     */
    public Optional<Spectrum> spectrum(String name) {
        return get(name).flatMap(Param::spectrum);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ParamList other && params.equals(other.params);
    }

    @Override
    public int hashCode() {
        return params.hashCode();
    }

    @Override
    public String toString() {
        return params.values().toString();
    }
}
