package org.carball.showplan.model.plan;

public record QueryTimeStats(
        long cpuTimeMs,
        long elapsedTimeMs,
        long udfCpuTimeMs,
        long udfElapsedTimeMs
) {}
