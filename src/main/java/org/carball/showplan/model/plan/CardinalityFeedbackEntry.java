package org.carball.showplan.model.plan;

public record CardinalityFeedbackEntry(
        long key,
        long value
) {}
