package org.carball.showplan.analyzer.rules;

import lombok.RequiredArgsConstructor;
import org.carball.showplan.analyzer.NodeRule;
import org.carball.showplan.config.AnalyzerThresholds;
import org.carball.showplan.model.plan.PlanNode;
import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.model.plan.PlanWarning;
import org.carball.showplan.model.plan.WarningSeverity;

import java.util.List;
import java.util.Locale;

/**
 * Compares estimated and actual rows on operators of an actual plan.
 */
@RequiredArgsConstructor
public class RowEstimateMismatchRule implements NodeRule {

    static final String CATEGORY = "Row Estimate Mismatch";

    private final AnalyzerThresholds thresholds;

    @Override
    public List<PlanWarning> evaluate(PlanNode node, PlanStatement statement) {
        if (!node.hasActualStats() || node.getEstimateRows() <= 0) {
            return List.of();
        }

        double estimated = node.getEstimateRows();
        if (node.getActualRows() == 0) {
            WarningSeverity severity = estimated >= thresholds.getZeroRowsCriticalEstimate()
                    ? WarningSeverity.CRITICAL
                    : WarningSeverity.WARNING;
            return List.of(PlanWarning.of(CATEGORY,
                    "Estimated " + RuleSupport.number(estimated) + " rows but actual 0 rows returned. "
                            + "SQL Server allocated resources for rows that never materialized.",
                    severity));
        }

        double ratio = node.getActualRows() / estimated;
        double mismatch = thresholds.getEstimateMismatchRatio();
        boolean under = ratio >= mismatch;
        if (!under && ratio > 1.0 / mismatch) {
            return List.of();
        }

        double factor = under ? ratio : estimated / node.getActualRows();
        WarningSeverity severity = factor >= thresholds.getEstimateMismatchCriticalFactor()
                ? WarningSeverity.CRITICAL
                : WarningSeverity.WARNING;
        String message = String.format(Locale.US,
                "Estimated %,.0f rows, actual %,d (%.0fx %s). Bad estimates cause SQL Server to choose wrong "
                        + "join types, memory grants, and parallelism.",
                estimated, node.getActualRows(), factor, under ? "underestimated" : "overestimated");
        return List.of(PlanWarning.of(CATEGORY, message, severity));
    }
}
