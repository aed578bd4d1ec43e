package org.carball.showplan.model.plan;

public record TraceFlag(
        int value,
        String scope,
        boolean compileTime
) {}
