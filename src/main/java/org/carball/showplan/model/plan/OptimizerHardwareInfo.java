package org.carball.showplan.model.plan;

public record OptimizerHardwareInfo(
        long estimatedAvailableMemoryGrant,
        long estimatedPagesCached,
        int estimatedAvailableDop,
        long maxCompileMemory
) {}
