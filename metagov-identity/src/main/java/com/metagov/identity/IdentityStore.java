package com.metagov.identity;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Arena for identity rows. MetagovIds are indexed by internal id (the adjacency key) and by external id;
 * LinkedAccounts by their uniqueness tuple. Accounts are claimed with {@code putIfAbsent}, so two writers
 * can never both create the same tuple.
 */
final class IdentityStore {

    private final Map<Long, MetagovId> byInternalId = new ConcurrentHashMap<>();
    private final Map<Long, Long> internalByExternalId = new ConcurrentHashMap<>();
    private final Map<AccountKey, LinkedAccount> accounts = new ConcurrentHashMap<>();

    /** @return false if either id is already taken */
    boolean insertId(MetagovId id) {
        if (internalByExternalId.putIfAbsent(id.getExternalId(), id.getInternalId()) != null) {
            return false;
        }
        if (byInternalId.putIfAbsent(id.getInternalId(), id) != null) {
            internalByExternalId.remove(id.getExternalId());
            return false;
        }
        return true;
    }

    Optional<MetagovId> findByInternalId(long internalId) {
        return Optional.ofNullable(byInternalId.get(internalId));
    }

    Optional<MetagovId> findByExternalId(long externalId) {
        Long internal = internalByExternalId.get(externalId);
        return internal != null ? findByInternalId(internal) : Optional.empty();
    }

    /** Replaces the given nodes; callers hold the graph lock and have validated the result. */
    void replaceIds(List<MetagovId> updated) {
        for (MetagovId id : updated) {
            byInternalId.put(id.getInternalId(), id);
        }
    }

    /** Members of the node's connected link-group, including the node itself. */
    List<MetagovId> group(MetagovId start) {
        Set<Long> seen = new LinkedHashSet<>();
        Deque<Long> queue = new ArrayDeque<>();
        queue.add(start.getInternalId());
        List<MetagovId> members = new ArrayList<>();
        while (!queue.isEmpty()) {
            long next = queue.poll();
            if (!seen.add(next)) continue;
            MetagovId node = byInternalId.get(next);
            if (node == null) continue;
            members.add(node);
            queue.addAll(node.getLinkedIds());
        }
        return members;
    }

    Optional<LinkedAccount> findAccount(AccountKey key) {
        return Optional.ofNullable(accounts.get(key));
    }

    /** @return the account already holding the tuple, or null if the claim succeeded */
    LinkedAccount claimAccount(LinkedAccount account) {
        return accounts.putIfAbsent(account.key(), account);
    }

    void replaceAccount(LinkedAccount account) {
        accounts.put(account.key(), account);
    }

    List<LinkedAccount> accountsOf(Set<Long> internalIds) {
        List<LinkedAccount> out = new ArrayList<>();
        for (LinkedAccount account : accounts.values()) {
            if (internalIds.contains(account.getMetagovInternalId())) {
                out.add(account);
            }
        }
        out.sort((a, b) -> Long.compare(a.getId(), b.getId()));
        return out;
    }

    /** @return number of ids removed */
    int deleteCommunity(long communityId) {
        accounts.values().removeIf(a -> a.getCommunity().getId() == communityId);
        List<MetagovId> removed = new ArrayList<>();
        for (MetagovId id : byInternalId.values()) {
            if (id.getCommunityId() == communityId) removed.add(id);
        }
        for (MetagovId id : removed) {
            byInternalId.remove(id.getInternalId());
            internalByExternalId.remove(id.getExternalId());
        }
        return removed.size();
    }

    int accountCount() {
        return accounts.size();
    }
}
