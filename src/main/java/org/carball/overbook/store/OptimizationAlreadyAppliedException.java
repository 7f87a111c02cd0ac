package org.carball.overbook.store;

import java.util.UUID;

public class OptimizationAlreadyAppliedException extends RuntimeException {

    public OptimizationAlreadyAppliedException(UUID id) {
        super("Optimization already applied: " + id);
    }
}
