package org.carball.overbook.store;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryOptimizationStore implements OptimizationStore {

    private final Map<UUID, StoredOptimization> optimizations = new ConcurrentHashMap<>();

    @Override
    public StoredOptimization save(StoredOptimization optimization) {
        optimizations.put(optimization.id(), optimization);
        return optimization;
    }

    @Override
    public Optional<StoredOptimization> findById(UUID id) {
        return Optional.ofNullable(optimizations.get(id));
    }

    public int size() {
        return optimizations.size();
    }
}
