package org.carball.showplan.model.plan;

public record ThreadStats(
        int branches,
        int usedThreads
) {}
