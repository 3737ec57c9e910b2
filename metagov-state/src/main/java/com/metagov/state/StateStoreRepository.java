package com.metagov.state;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Arena of state stores keyed by id. Owners hold the id (or the handle) and ask the repository
 * to create the store with them and delete it with them.
 */
public final class StateStoreRepository {

    private static final Logger log = LoggerFactory.getLogger(StateStoreRepository.class);

    private final Map<Long, JsonStateStore> stores = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();

    /** Creates an empty store. */
    public KeyValueStateStore create() {
        JsonStateStore store = new JsonStateStore(ids.incrementAndGet());
        stores.put(store.getId(), store);
        return store;
    }

    public Optional<KeyValueStateStore> find(long id) {
        return Optional.ofNullable(stores.get(id));
    }

    /**
     * Returns the store for the id.
     *
     * @throws IllegalStateException if the store does not exist (its owner was deleted)
     */
    public KeyValueStateStore get(long id) {
        JsonStateStore store = stores.get(id);
        if (store == null) {
            throw new IllegalStateException("State store " + id + " does not exist");
        }
        return store;
    }

    public boolean exists(long id) {
        return stores.containsKey(id);
    }

    /**
     * Deletes the store; later writes through any held handle fail.
     *
     * @return true if the store existed
     */
    public boolean delete(long id) {
        JsonStateStore store = stores.remove(id);
        if (store == null) {
            return false;
        }
        store.markDeleted();
        log.debug("Deleted state store {}", id);
        return true;
    }

    /** Number of live stores. */
    public int size() {
        return stores.size();
    }
}
