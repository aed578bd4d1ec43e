package org.carball.showplan.analyzer.rules;

import lombok.RequiredArgsConstructor;
import org.carball.showplan.analyzer.NodeRule;
import org.carball.showplan.config.AnalyzerThresholds;
import org.carball.showplan.model.plan.PlanNode;
import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.model.plan.PlanWarning;
import org.carball.showplan.model.plan.WarningSeverity;

import java.util.List;

/**
 * Filter operators discard rows that were already read and joined.
 */
@RequiredArgsConstructor
public class FilterOperatorRule implements NodeRule {

    private final AnalyzerThresholds thresholds;

    @Override
    public List<PlanWarning> evaluate(PlanNode node, PlanStatement statement) {
        if (!node.isPhysicalOp("Filter") || !node.hasPredicate()) {
            return List.of();
        }
        return List.of(PlanWarning.of("Filter Operator",
                "Filter operator discarding rows late in the plan. Rows were read, joined, or processed only to "
                        + "be thrown away here. Predicate: "
                        + RuleSupport.truncate(node.getPredicate(), thresholds.getPredicateDisplayLength()),
                WarningSeverity.WARNING));
    }
}
