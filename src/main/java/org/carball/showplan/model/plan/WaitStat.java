package org.carball.showplan.model.plan;

public record WaitStat(
        String waitType,
        long waitTimeMs,
        long waitCount
) {}
