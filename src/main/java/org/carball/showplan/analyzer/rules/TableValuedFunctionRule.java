package org.carball.showplan.analyzer.rules;

import org.carball.showplan.analyzer.NodeRule;
import org.carball.showplan.model.plan.PlanNode;
import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.model.plan.PlanWarning;
import org.carball.showplan.model.plan.WarningSeverity;

import java.util.List;

public class TableValuedFunctionRule implements NodeRule {

    @Override
    public List<PlanWarning> evaluate(PlanNode node, PlanStatement statement) {
        if (!"Table-valued function".equals(node.getLogicalOp())) {
            return List.of();
        }
        String functionName = node.getObjectName() != null ? node.getObjectName() : node.getPhysicalOp();
        return List.of(PlanWarning.of("Table-Valued Function",
                "Table-valued function: " + functionName + ". Multi-statement TVFs have no statistics - SQL Server "
                        + "guesses 1 row (pre-2017) or 100 rows (2017+) regardless of actual size. Rewrite as an "
                        + "inline table-valued function if possible, or dump the function results into a #temp "
                        + "table and join to that instead.",
                WarningSeverity.WARNING));
    }
}
