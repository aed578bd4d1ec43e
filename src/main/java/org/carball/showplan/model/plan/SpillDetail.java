package org.carball.showplan.model.plan;

/**
 * Structured spill figures carried by sort, hash and exchange spill warnings.
 */
public record SpillDetail(
        SpillKind kind,
        long grantedMemoryKb,
        long usedMemoryKb,
        long writesToTempDb,
        long readsFromTempDb
) {}
