package com.metagov.identity;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Canonical identity node (immutable snapshot). {@code internalId} never leaves the core;
 * {@code externalId} is what integrations and the driver see. Links are held as internal ids
 * of the other nodes, never as object references.
 */
public final class MetagovId {

    private final long communityId;
    private final long internalId;
    private final long externalId;
    private final boolean primary;
    private final Set<Long> linkedIds;

    MetagovId(long communityId, long internalId, long externalId, boolean primary, Set<Long> linkedIds) {
        this.communityId = communityId;
        this.internalId = internalId;
        this.externalId = externalId;
        this.primary = primary;
        this.linkedIds = Collections.unmodifiableSet(new TreeSet<>(Objects.requireNonNull(linkedIds, "linkedIds")));
    }

    public long getCommunityId() {
        return communityId;
    }

    long getInternalId() {
        return internalId;
    }

    public long getExternalId() {
        return externalId;
    }

    /** Raw primary flag as stored. */
    public boolean getPrimaryFlag() {
        return primary;
    }

    Set<Long> getLinkedIds() {
        return linkedIds;
    }

    public boolean hasLinks() {
        return !linkedIds.isEmpty();
    }

    /** Effective primary: flag set, or no links at all. */
    public boolean isPrimary() {
        return primary || linkedIds.isEmpty();
    }

    MetagovId withPrimary(boolean flag) {
        return new MetagovId(communityId, internalId, externalId, flag, linkedIds);
    }

    MetagovId withLinkedIds(Set<Long> ids) {
        return new MetagovId(communityId, internalId, externalId, primary, ids);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MetagovId that = (MetagovId) o;
        return internalId == that.internalId && externalId == that.externalId && primary == that.primary
                && communityId == that.communityId && linkedIds.equals(that.linkedIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(internalId, externalId, primary, communityId, linkedIds);
    }

    @Override
    public String toString() {
        return "MetagovId(external=" + externalId + ", primary=" + primary + ", links=" + linkedIds.size() + ")";
    }
}
