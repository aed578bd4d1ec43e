package org.carball.showplan.analyzer.rules;

import org.carball.showplan.analyzer.NodeRule;
import org.carball.showplan.model.plan.PlanNode;
import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.model.plan.PlanWarning;
import org.carball.showplan.model.plan.WarningSeverity;

import java.util.List;

public class TableVariableRule implements NodeRule {

    @Override
    public List<PlanWarning> evaluate(PlanNode node, PlanStatement statement) {
        String objectName = node.getObjectName();
        if (objectName == null || !objectName.startsWith("@")) {
            return List.of();
        }
        return List.of(PlanWarning.of("Table Variable",
                "Table variable detected. Table variables lack column-level statistics, which causes bad row "
                        + "estimates, join choices, and memory grant decisions. Replace with a #temp table.",
                WarningSeverity.WARNING));
    }
}
