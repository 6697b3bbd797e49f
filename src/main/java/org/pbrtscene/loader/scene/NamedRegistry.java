package org.pbrtscene.loader.scene;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * An append-only list of entities plus a name to index map.
 * Entries are never removed; redefining a name points it at the newest entry.
 *
 * @param <T> The entity type.
 */
public final class NamedRegistry<T> {

    private final List<T> entries = new ArrayList<>();
    private final Map<String, Integer> indexByName = new HashMap<>();

    /**
     * Appends an anonymous entity.
     * @return Its index.
     */
    public int add(T entity) {
        entries.add(entity);
        return entries.size() - 1;
    }

    /**
     * Appends an entity and binds {@code name} to it.
     * @return Its index.
     */
    public int add(String name, T entity) {
        int index = add(entity);
        indexByName.put(name, index);
        return index;
    }

    /**
     * @return The index bound to {@code name}, or null if the name was never defined.
     */
    public Integer indexOf(String name) {
        return indexByName.get(name);
    }

    public int size() {
        return entries.size();
    }

    public List<T> entries() {
        return Collections.unmodifiableList(entries);
    }

    public Map<String, Integer> names() {
        return Collections.unmodifiableMap(indexByName);
    }
}
