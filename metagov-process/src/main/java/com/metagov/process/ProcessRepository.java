package com.metagov.process;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/** In-memory process rows. Reads and writes go through copies. */
final class ProcessRepository {

    private final Map<Long, GovernanceProcess> rows = new ConcurrentHashMap<>();

    void insert(GovernanceProcess process) {
        if (rows.putIfAbsent(process.getId(), process.copy()) != null) {
            throw new IllegalStateException("Process " + process.getId() + " already exists");
        }
    }

    Optional<GovernanceProcess> find(long id) {
        GovernanceProcess row = rows.get(id);
        return Optional.ofNullable(row != null ? row.copy() : null);
    }

    /**
     * Overwrites an existing row; a deleted row stays deleted.
     *
     * @return false if the row no longer exists
     */
    boolean update(GovernanceProcess process) {
        GovernanceProcess copy = process.copy();
        return rows.computeIfPresent(process.getId(), (k, v) -> copy) != null;
    }

    boolean delete(long id) {
        return rows.remove(id) != null;
    }

    List<GovernanceProcess> list(Predicate<GovernanceProcess> filter) {
        List<GovernanceProcess> out = rows.values().stream()
                .filter(filter)
                .map(GovernanceProcess::copy)
                .collect(Collectors.toCollection(ArrayList::new));
        out.sort(Comparator.comparingLong(GovernanceProcess::getId));
        return out;
    }

    int size() {
        return rows.size();
    }
}
