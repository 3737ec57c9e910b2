package com.metagov.state;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link KeyValueStateStore} that keeps every value as a JSON document (one per key), encoded with
 * {@link TypedValueCodec} so scalars read back with the Java type they were written with.
 * Instances are created and deleted only through {@link StateStoreRepository}.
 */
final class JsonStateStore implements KeyValueStateStore {

    private final long id;
    private final Map<String, String> documents = new ConcurrentHashMap<>();
    private volatile boolean deleted;

    JsonStateStore(long id) {
        this.id = id;
    }

    @Override
    public long getId() {
        return id;
    }

    @Override
    public Object get(String key) {
        String json = documents.get(Objects.requireNonNull(key, "key"));
        if (json == null) {
            return null;
        }
        try {
            return TypedValueCodec.decode(json);
        } catch (IllegalStateException e) {
            throw new IllegalStateException("Corrupt value in state store " + id + " for key " + key, e);
        }
    }

    @Override
    public <T> T get(String key, Class<T> type) {
        Objects.requireNonNull(type, "type");
        return TypedValueCodec.convert(get(key), type);
    }

    @Override
    public void set(String key, Object value) {
        Objects.requireNonNull(key, "key");
        ensureLive();
        String json;
        try {
            json = TypedValueCodec.encode(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Value for key " + key + " is not JSON-encodable", e);
        }
        documents.put(key, json);
    }

    @Override
    public boolean remove(String key) {
        Objects.requireNonNull(key, "key");
        ensureLive();
        return documents.remove(key) != null;
    }

    @Override
    public Set<String> keys() {
        return new TreeSet<>(documents.keySet());
    }

    void markDeleted() {
        deleted = true;
        documents.clear();
    }

    private void ensureLive() {
        if (deleted) {
            throw new IllegalStateException("State store " + id + " has been deleted");
        }
    }

    @Override
    public String toString() {
        return "StateStore(" + id + ", keys=" + documents.size() + ")";
    }
}
