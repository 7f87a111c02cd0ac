package org.carball.overbook.store;

import org.carball.overbook.model.optimization.OptimizationResult;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

public record StoredOptimization(
    UUID id,
    String practiceId,
    String providerId,
    LocalDate optimizationDate,
    OptimizationResult result,
    boolean applied,
    Instant appliedAt,
    String appliedBy
) {
    public static StoredOptimization pending(String practiceId, String providerId,
                                             LocalDate optimizationDate, OptimizationResult result) {
        return new StoredOptimization(UUID.randomUUID(), practiceId, providerId, optimizationDate,
                result, false, null, null);
    }

    public StoredOptimization markApplied(Instant at, String by) {
        return new StoredOptimization(id, practiceId, providerId, optimizationDate, result, true, at, by);
    }
}
