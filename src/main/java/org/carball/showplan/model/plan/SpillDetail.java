package org.carball.showplan.model.plan;

/**
 * Structured payload of a spill warning. Counters the document does not state are 0.
 */
public record SpillDetail(
        String spillType,
        int spillLevel,
        int spilledThreadCount,
        long grantedMemoryKB,
        long usedMemoryKB,
        long writesToTempDb,
        long readsFromTempDb
) {}
