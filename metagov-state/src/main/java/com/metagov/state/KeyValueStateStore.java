package com.metagov.state;

import java.util.Set;

/**
 * Durable key-value scratch space owned by exactly one plugin instance or governance process.
 * Values may be any composition of maps, lists and scalars; they are stored encoded, so a value
 * read back is deep-equal to the value written but never the same object.
 * <p>
 * <b>Lifecycle:</b> created alongside its owner and deleted with it. Writes to a deleted store fail
 * with {@link IllegalStateException}.
 */
public interface KeyValueStateStore {

    /** Arena id of this store. */
    long getId();

    /**
     * Returns the decoded value for the key, or null if absent. Maps decode to {@code Map<String, Object>},
     * collections and arrays to {@code List<Object>}; numbers keep the boxed type they were written with.
     */
    Object get(String key);

    /**
     * Returns the value converted to the given type, or null if absent.
     *
     * @throws IllegalArgumentException if the value cannot be converted
     */
    <T> T get(String key, Class<T> type);

    /**
     * Stores the value under the key, replacing any previous value.
     *
     * @throws IllegalArgumentException if the value cannot be encoded as JSON
     * @throws IllegalStateException    if the store has been deleted
     */
    void set(String key, Object value);

    /**
     * Removes the key.
     *
     * @return true if a value was present
     */
    boolean remove(String key);

    /** Keys currently present. */
    Set<String> keys();
}
