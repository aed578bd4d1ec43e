package org.carball.showplan.model.plan;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Statements compiled for a user-defined function or stored procedure invoked by
 * an outer statement. They are kept apart from the batch's own statements.
 */
@Data
public class SubPlan {
    private String name = "";
    private boolean nativelyCompiled;
    private List<PlanStatement> statements = new ArrayList<>();
}
