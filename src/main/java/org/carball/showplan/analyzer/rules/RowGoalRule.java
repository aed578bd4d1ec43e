package org.carball.showplan.analyzer.rules;

import org.carball.showplan.analyzer.NodeRule;
import org.carball.showplan.model.plan.PlanNode;
import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.model.plan.PlanWarning;
import org.carball.showplan.model.plan.WarningSeverity;

import java.util.List;

public class RowGoalRule implements NodeRule {

    @Override
    public List<PlanWarning> evaluate(PlanNode node, PlanStatement statement) {
        double withoutGoal = node.getEstimateRowsWithoutRowGoal();
        double estimated = node.getEstimateRows();
        if (withoutGoal <= 0 || estimated <= 0 || withoutGoal <= estimated) {
            return List.of();
        }

        double reduction = withoutGoal / estimated;
        return List.of(PlanWarning.of("Row Goal",
                "Row goal active: estimate reduced from " + RuleSupport.number(withoutGoal) + " to "
                        + RuleSupport.number(estimated) + " (" + RuleSupport.number(reduction) + "x reduction) due "
                        + "to TOP, EXISTS, IN, or FAST hint. The optimizer chose this plan shape expecting to stop "
                        + "reading early. If the query reads all rows anyway, the plan choice may be suboptimal.",
                WarningSeverity.INFO));
    }
}
