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
 * Nested Loops joins whose inner side runs a very large number of times.
 */
@RequiredArgsConstructor
public class NestedLoopsExecutionsRule implements NodeRule {

    static final String CATEGORY = "Nested Loops High Executions";

    private final AnalyzerThresholds thresholds;

    @Override
    public List<PlanWarning> evaluate(PlanNode node, PlanStatement statement) {
        if (!node.isPhysicalOp("Nested Loops")
                || !RuleSupport.containsIgnoreCase(node.getLogicalOp(), "Join")
                || node.getChildren().size() < 2) {
            return List.of();
        }

        PlanNode inner = node.getChildren().get(1);
        if (inner.hasActualStats()) {
            long executions = inner.getActualExecutions();
            if (executions <= thresholds.getNestedLoopsWarningExecutions()) {
                return List.of();
            }
            int dop = statement.getDegreeOfParallelism() > 0 ? statement.getDegreeOfParallelism() : 1;
            return List.of(PlanWarning.of(CATEGORY,
                    "Nested Loops inner side executed " + RuleSupport.number(executions) + " times (DOP " + dop
                            + "). This is likely caused by parameter sniffing or a bad row estimate on the outer "
                            + "side - the optimizer chose Nested Loops expecting far fewer rows.",
                    severity(executions)));
        }

        double rebinds = inner.getEstimateRebinds();
        if (rebinds <= thresholds.getNestedLoopsWarningExecutions()) {
            return List.of();
        }
        return List.of(PlanWarning.of(CATEGORY,
                "Nested Loops inner side estimated to execute " + RuleSupport.number(rebinds + 1) + " times. "
                        + "This may be caused by parameter sniffing or a poor estimate on the outer side.",
                severity(rebinds)));
    }

    private WarningSeverity severity(double executions) {
        return executions > thresholds.getNestedLoopsCriticalExecutions()
                ? WarningSeverity.CRITICAL
                : WarningSeverity.WARNING;
    }
}
