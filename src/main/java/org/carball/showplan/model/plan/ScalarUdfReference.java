package org.carball.showplan.model.plan;

public record ScalarUdfReference(
        String functionName,
        boolean clrFunction
) {}
