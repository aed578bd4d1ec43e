package org.carball.showplan.model.plan;

/**
 * Runtime counters reported by a single execution thread of an operator.
 */
public record ThreadCounters(
        int threadId,
        long actualRows,
        long actualExecutions,
        long actualElapsedMs,
        long actualCpuMs,
        long actualRowsRead,
        long actualLogicalReads,
        long actualPhysicalReads,
        long actualScans,
        long actualReadAheads
) {}
