package org.carball.overbook.store;

import java.util.Optional;
import java.util.UUID;

/**
 * Persistence for optimization results.
 */
public interface OptimizationStore {

    StoredOptimization save(StoredOptimization optimization);

    Optional<StoredOptimization> findById(UUID id);
}
