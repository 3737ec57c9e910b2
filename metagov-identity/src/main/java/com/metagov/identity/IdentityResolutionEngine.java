package com.metagov.identity;

import com.metagov.community.Community;
import com.metagov.errors.AccountNotFoundException;
import com.metagov.errors.DuplicateLinkException;
import com.metagov.errors.IntegrityViolationException;
import com.metagov.errors.NoPrimaryFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Maintains the MetagovId graph and the LinkedAccounts bound to it.
 * <p>
 * <b>Invariant:</b> in every committed link-group with more than one member exactly one member has its
 * primary flag set. Graph writes (merge, primary changes) are serialized on one lock and validated before
 * they are committed; account writes are serialized per uniqueness tuple so the quality-upgrade-only rule
 * holds under concurrent callers.
 */
public final class IdentityResolutionEngine {

    private static final Logger log = LoggerFactory.getLogger(IdentityResolutionEngine.class);
    private static final long MAX_EXTERNAL_ID = Integer.MAX_VALUE;

    private final IdentityStore store = new IdentityStore();
    private final AtomicLong internalIds = new AtomicLong();
    private final AtomicLong accountIds = new AtomicLong();
    private final ReentrantLock graphLock = new ReentrantLock();
    private final Map<AccountKey, TupleLock> accountLocks = new ConcurrentHashMap<>();

    /** Lock for one account tuple; the table entry lives only while some caller holds or awaits it. */
    private static final class TupleLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int holders;
    }

    /** Mints a fresh primary MetagovId with no links. */
    public MetagovId createId(Community community) {
        Objects.requireNonNull(community, "community");
        while (true) {
            long externalId = ThreadLocalRandom.current().nextLong(1, MAX_EXTERNAL_ID);
            MetagovId id = new MetagovId(community.getId(), internalIds.incrementAndGet(), externalId, true, Set.of());
            if (store.insertId(id)) {
                log.debug("Created MetagovId {} in community {}", externalId, community.getSlug());
                return id;
            }
        }
    }

    /**
     * @throws AccountNotFoundException if the id does not exist in the community
     */
    public MetagovId getIdentity(Community community, long externalId) {
        MetagovId id = store.findByExternalId(externalId)
                .orElseThrow(() -> new AccountNotFoundException("No MetagovId with external id " + externalId));
        if (id.getCommunityId() != community.getId()) {
            throw new AccountNotFoundException("No MetagovId with external id " + externalId + " in " + community.getSlug());
        }
        return id;
    }

    /**
     * Exact lookup by the account uniqueness tuple.
     *
     * @throws AccountNotFoundException if no account holds the tuple
     */
    public LinkedAccount retrieveAccount(Community community, String platformType, String platformIdentifier,
                                         String communityPlatformId) {
        AccountKey key = new AccountKey(community.getId(), platformType, platformIdentifier, communityPlatformId);
        return store.findAccount(key)
                .orElseThrow(() -> new AccountNotFoundException("No LinkedAccount for " + key));
    }

    /**
     * Creates a LinkedAccount under an existing MetagovId.
     *
     * @throws AccountNotFoundException if the MetagovId does not exist in the community
     * @throws DuplicateLinkException   if another account already holds the tuple
     */
    public LinkedAccount linkAccount(long externalId, Community community, String platformType,
                                     String platformIdentifier, String communityPlatformId, LinkOptions options) {
        MetagovId owner = getIdentity(community, externalId);
        LinkOptions opts = options != null ? options : LinkOptions.none();
        LinkedAccount account = new LinkedAccount(accountIds.incrementAndGet(), owner.getInternalId(), owner.getExternalId(),
                community, communityPlatformId, platformType, platformIdentifier, opts.customData(),
                opts.linkType(), opts.linkQuality());
        LinkedAccount existing = store.claimAccount(account);
        if (existing != null) {
            throw new DuplicateLinkException("LinkedAccount already exists: " + account.key()
                    + " (owned by " + existing.getExternalId() + ")");
        }
        log.debug("Linked {} to MetagovId {}", account, externalId);
        return account;
    }

    /**
     * Updates the supplied fields of the account holding the tuple.
     *
     * @throws AccountNotFoundException if no account holds the tuple
     */
    public LinkedAccount updateLinkedAccount(Community community, String platformType, String platformIdentifier,
                                             String communityPlatformId, LinkOptions options) {
        AccountKey key = new AccountKey(community.getId(), platformType, platformIdentifier, communityPlatformId);
        TupleLock lock = acquire(key);
        try {
            LinkedAccount current = store.findAccount(key)
                    .orElseThrow(() -> new AccountNotFoundException("No LinkedAccount for " + key));
            LinkedAccount updated = current.withUpdates(options != null ? options : LinkOptions.none());
            store.replaceAccount(updated);
            return updated;
        } finally {
            release(key, lock);
        }
    }

    /**
     * Creates or upgrades the account for a platform identifier in the given scope. An existing account is
     * only overwritten when the new link quality is strictly higher than the stored one; otherwise it is
     * returned unchanged. A missing account is created under {@code options.externalId()}, or under a newly
     * minted MetagovId when none is given.
     */
    public LinkedAccount addLinkedAccount(PlatformScope scope, String platformIdentifier, LinkOptions options) {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(platformIdentifier, "platformIdentifier");
        LinkOptions opts = options != null ? options : LinkOptions.none();
        Community community = scope.getCommunity();
        AccountKey key = new AccountKey(community.getId(), scope.getPlatformType(), platformIdentifier,
                scope.getCommunityPlatformId());
        TupleLock lock = acquire(key);
        try {
            LinkedAccount existing = store.findAccount(key).orElse(null);
            if (existing != null) {
                if (opts.linkQuality() != null && opts.linkQuality().isGreaterThan(existing.getLinkQuality())) {
                    log.debug("Upgrading {} to {}", existing, opts.linkQuality().value());
                    return updateLinkedAccount(community, scope.getPlatformType(), platformIdentifier,
                            scope.getCommunityPlatformId(), opts);
                }
                return existing;
            }
            long externalId = opts.externalId() != null ? opts.externalId() : createId(community).getExternalId();
            return linkAccount(externalId, community, scope.getPlatformType(), platformIdentifier,
                    scope.getCommunityPlatformId(), opts);
        } finally {
            release(key, lock);
        }
    }

    /** All accounts linked to any member of the id's link-group. */
    public List<LinkedAccount> getLinkedAccounts(Community community, long externalId) {
        MetagovId id = getIdentity(community, externalId);
        Set<Long> members = store.group(id).stream().map(MetagovId::getInternalId).collect(Collectors.toSet());
        return store.accountsOf(members);
    }

    /** Effective primary: own flag set, or no links at all. */
    public boolean isPrimary(MetagovId id) {
        return current(id).isPrimary();
    }

    /**
     * Returns the primary node of the id's link-group.
     *
     * @throws NoPrimaryFoundException if no linked node is primary (corrupted data)
     */
    public MetagovId getPrimaryId(MetagovId id) {
        MetagovId node = current(id);
        if (node.isPrimary()) {
            return node;
        }
        for (Long linked : node.getLinkedIds()) {
            MetagovId other = store.findByInternalId(linked).orElse(null);
            if (other != null && other.isPrimary()) {
                return other;
            }
        }
        throw new NoPrimaryFoundException("No primary ID associated with " + node.getExternalId());
    }

    /** External-id variant of {@link #getPrimaryId(MetagovId)}. */
    public MetagovId getPrimaryId(Community community, long externalId) {
        return getPrimaryId(getIdentity(community, externalId));
    }

    /**
     * Joins the link-groups of two ids so every member links every other member. The merged group must
     * contain exactly one member with the primary flag set; callers choose the survivor beforehand with
     * {@link #setPrimary}. Merging ids already in one group is a no-op.
     *
     * @return the primary of the merged group
     * @throws IntegrityViolationException if the merged group would have zero or several primaries; nothing
     *                                     is changed
     * @throws AccountNotFoundException    if either id does not exist in the community
     */
    public MetagovId mergeIds(Community community, long externalIdA, long externalIdB) {
        graphLock.lock();
        try {
            MetagovId a = getIdentity(community, externalIdA);
            MetagovId b = getIdentity(community, externalIdB);
            List<MetagovId> groupA = store.group(a);
            if (groupA.stream().anyMatch(m -> m.getInternalId() == b.getInternalId())) {
                return getPrimaryId(a);
            }
            List<MetagovId> merged = new ArrayList<>(groupA);
            merged.addAll(store.group(b));
            long primaries = merged.stream().filter(MetagovId::getPrimaryFlag).count();
            if (primaries == 0) {
                throw new IntegrityViolationException("At least one linked ID must have 'primary' set to true");
            }
            if (primaries > 1) {
                throw new IntegrityViolationException("More than one linked ID has 'primary' set to true ("
                        + externalIdA + ", " + externalIdB + ")");
            }
            Set<Long> all = merged.stream().map(MetagovId::getInternalId).collect(Collectors.toSet());
            List<MetagovId> updated = new ArrayList<>(merged.size());
            for (MetagovId member : merged) {
                Set<Long> links = new HashSet<>(all);
                links.remove(member.getInternalId());
                updated.add(member.withLinkedIds(links));
            }
            store.replaceIds(updated);
            log.info("Merged MetagovIds {} and {} into a group of {}", externalIdA, externalIdB, updated.size());
            return updated.stream().filter(MetagovId::getPrimaryFlag).findFirst()
                    .orElseThrow(() -> new NoPrimaryFoundException("No primary after merge"));
        } finally {
            graphLock.unlock();
        }
    }

    /**
     * Sets the raw primary flag of one id. On an id without links any value is accepted (it stays effectively
     * primary). Inside a group the change must leave exactly one primary.
     *
     * @throws IntegrityViolationException if the group would have zero or several primaries
     */
    public MetagovId setPrimary(Community community, long externalId, boolean primary) {
        graphLock.lock();
        try {
            MetagovId id = getIdentity(community, externalId);
            MetagovId updated = id.withPrimary(primary);
            if (id.hasLinks()) {
                Map<Long, MetagovId> group = new HashMap<>();
                for (MetagovId m : store.group(id)) group.put(m.getInternalId(), m);
                group.put(updated.getInternalId(), updated);
                requireSinglePrimary(group.values(), externalId);
            }
            store.replaceIds(List.of(updated));
            return updated;
        } finally {
            graphLock.unlock();
        }
    }

    /** Makes the id the primary of its group, clearing the flag on every other member in the same commit. */
    public MetagovId makePrimary(Community community, long externalId) {
        graphLock.lock();
        try {
            MetagovId id = getIdentity(community, externalId);
            List<MetagovId> updated = new ArrayList<>();
            for (MetagovId member : store.group(id)) {
                updated.add(member.withPrimary(member.getInternalId() == id.getInternalId()));
            }
            store.replaceIds(updated);
            return store.findByInternalId(id.getInternalId()).orElseThrow();
        } finally {
            graphLock.unlock();
        }
    }

    /** Removes every id and account of the community. */
    public void deleteCommunity(Community community) {
        graphLock.lock();
        try {
            int removed = store.deleteCommunity(community.getId());
            log.debug("Deleted {} MetagovId(s) of community {}", removed, community.getSlug());
        } finally {
            graphLock.unlock();
        }
    }

    /** Number of stored accounts across all communities. */
    public int accountCount() {
        return store.accountCount();
    }

    private static void requireSinglePrimary(Iterable<MetagovId> group, long externalId) {
        int count = 0;
        for (MetagovId m : group) {
            if (m.getPrimaryFlag()) count++;
        }
        if (count == 0) {
            throw new IntegrityViolationException("At least one linked ID must have 'primary' set to true (" + externalId + ")");
        }
        if (count > 1) {
            throw new IntegrityViolationException("More than one linked ID has 'primary' set to true (" + externalId + ")");
        }
    }

    private MetagovId current(MetagovId id) {
        Objects.requireNonNull(id, "id");
        return store.findByInternalId(id.getInternalId())
                .orElseThrow(() -> new AccountNotFoundException("No MetagovId with external id " + id.getExternalId()));
    }

    private TupleLock acquire(AccountKey key) {
        TupleLock tuple = accountLocks.compute(key, (k, current) -> {
            TupleLock held = current != null ? current : new TupleLock();
            held.holders++;
            return held;
        });
        tuple.lock.lock();
        return tuple;
    }

    private void release(AccountKey key, TupleLock tuple) {
        tuple.lock.unlock();
        accountLocks.computeIfPresent(key, (k, current) -> --current.holders == 0 ? null : current);
    }

    /** Number of account tuples currently locked or awaited. */
    int lockedTupleCount() {
        return accountLocks.size();
    }
}
