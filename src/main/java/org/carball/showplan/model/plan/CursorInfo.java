package org.carball.showplan.model.plan;

public record CursorInfo(
        String cursorName,
        String actualType,
        String requestedType,
        String concurrency,
        boolean forwardOnly,
        String operationType
) {}
