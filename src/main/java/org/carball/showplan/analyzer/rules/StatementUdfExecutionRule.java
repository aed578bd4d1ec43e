package org.carball.showplan.analyzer.rules;

import lombok.RequiredArgsConstructor;
import org.carball.showplan.analyzer.StatementRule;
import org.carball.showplan.config.AnalyzerThresholds;
import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.model.plan.PlanWarning;
import org.carball.showplan.model.plan.WarningSeverity;

import java.util.List;

/**
 * Scalar UDF time reported in the statement's query time stats. Some plans carry
 * UDF timing only at this level and never on an operator.
 */
@RequiredArgsConstructor
public class StatementUdfExecutionRule implements StatementRule {

    private final AnalyzerThresholds thresholds;

    @Override
    public List<PlanWarning> evaluate(PlanStatement statement) {
        long cpu = statement.getUdfCpuTimeMs();
        long elapsed = statement.getUdfElapsedTimeMs();
        if (cpu <= 0 && elapsed <= 0) {
            return List.of();
        }
        WarningSeverity severity = elapsed >= thresholds.getUdfElapsedCriticalMs()
                ? WarningSeverity.CRITICAL
                : WarningSeverity.WARNING;
        return List.of(PlanWarning.of(NodeUdfExecutionRule.CATEGORY,
                "Scalar UDF cost in this statement: " + RuleSupport.number(elapsed) + "ms elapsed, "
                        + RuleSupport.number(cpu) + "ms CPU. Scalar UDFs run once per row and prevent parallelism. "
                        + "Rewrite as an inline table-valued function, or dump results to a #temp table and apply "
                        + "the UDF only to the final result set.",
                severity));
    }
}
