package org.carball.overbook.store;

import java.util.UUID;

public class OptimizationNotFoundException extends RuntimeException {

    public OptimizationNotFoundException(UUID id) {
        super("Optimization not found: " + id);
    }
}
