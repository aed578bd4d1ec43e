package org.carball.showplan.analyzer.rules;

import lombok.RequiredArgsConstructor;
import org.carball.showplan.analyzer.NodeRule;
import org.carball.showplan.config.AnalyzerThresholds;
import org.carball.showplan.model.plan.PlanNode;
import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.model.plan.PlanWarning;
import org.carball.showplan.model.plan.WarningSeverity;

import java.util.List;

@RequiredArgsConstructor
public class NodeUdfExecutionRule implements NodeRule {

    static final String CATEGORY = "UDF Execution";

    private final AnalyzerThresholds thresholds;

    @Override
    public List<PlanWarning> evaluate(PlanNode node, PlanStatement statement) {
        long cpu = node.getUdfCpuTimeMs();
        long elapsed = node.getUdfElapsedTimeMs();
        if (cpu <= 0 && elapsed <= 0) {
            return List.of();
        }
        WarningSeverity severity = elapsed >= thresholds.getUdfElapsedCriticalMs()
                ? WarningSeverity.CRITICAL
                : WarningSeverity.WARNING;
        return List.of(PlanWarning.of(CATEGORY,
                "Scalar UDF executing on this operator (" + RuleSupport.number(elapsed) + "ms elapsed, "
                        + RuleSupport.number(cpu) + "ms CPU). Scalar UDFs run once per row and prevent parallelism. "
                        + "Rewrite as an inline table-valued function, or dump the query results to a #temp table "
                        + "first and apply the UDF only to the final result set.",
                severity));
    }
}
