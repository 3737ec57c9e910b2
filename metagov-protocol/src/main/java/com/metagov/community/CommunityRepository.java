package com.metagov.community;

import com.metagov.errors.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * In-memory store of communities keyed by slug. Deletion runs registered cascade listeners
 * (plugin instances, identities) before the community itself is removed.
 */
public final class CommunityRepository {

    private static final Logger log = LoggerFactory.getLogger(CommunityRepository.class);

    private final Map<String, Community> bySlug = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();
    private final List<Consumer<Community>> deletionListeners = new CopyOnWriteArrayList<>();

    /**
     * Creates a community. A null or blank slug is replaced by a random UUID.
     *
     * @throws IllegalArgumentException if the slug is already taken
     */
    public Community create(String slug, String readableName) {
        String s = slug == null || slug.isBlank() ? UUID.randomUUID().toString() : slug.trim();
        Community community = new Community(ids.incrementAndGet(), s, readableName);
        if (bySlug.putIfAbsent(s, community) != null) {
            throw new IllegalArgumentException("Community already exists: " + s);
        }
        log.debug("Created community {}", community);
        return community;
    }

    public Optional<Community> find(String slug) {
        if (slug == null) return Optional.empty();
        return Optional.ofNullable(bySlug.get(slug.trim()));
    }

    /**
     * @throws NotFoundException if no community has the slug
     */
    public Community get(String slug) {
        return find(slug).orElseThrow(() -> new NotFoundException("Community '" + slug + "' not found"));
    }

    public List<Community> list() {
        return new ArrayList<>(bySlug.values());
    }

    /** Registers a listener invoked for every deleted community, before it is removed. */
    public void addDeletionListener(Consumer<Community> listener) {
        if (listener != null) {
            deletionListeners.add(listener);
        }
    }

    /**
     * Deletes the community and cascades to everything it owns.
     *
     * @throws NotFoundException if no community has the slug
     */
    public void delete(String slug) {
        Community community = get(slug);
        for (Consumer<Community> listener : deletionListeners) {
            listener.accept(community);
        }
        bySlug.remove(community.getSlug());
        log.info("Deleted community {}", community);
    }
}
