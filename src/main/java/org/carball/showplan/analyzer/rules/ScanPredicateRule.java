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
 * Rowstore scans filtering with a residual predicate. A non-SARGable predicate is
 * reported as such; otherwise a plain scan-with-predicate finding is raised unless
 * the predicate is only a PROBE() bitmap.
 */
@RequiredArgsConstructor
public class ScanPredicateRule implements NodeRule {

    static final String NON_SARGABLE = "Non-SARGable Predicate";
    static final String SCAN_WITH_PREDICATE = "Scan With Predicate";

    private final AnalyzerThresholds thresholds;

    @Override
    public List<PlanWarning> evaluate(PlanNode node, PlanStatement statement) {
        String reason = NonSargablePredicates.detect(node);
        if (reason != null) {
            return List.of(PlanWarning.of(NON_SARGABLE,
                    NonSargablePredicates.advice(reason) + " Predicate: " + truncate(node.getPredicate()),
                    WarningSeverity.WARNING));
        }

        if (RuleSupport.isRowstoreScan(node) && node.hasPredicate()
                && !NonSargablePredicates.isProbeOnly(node.getPredicate())) {
            return List.of(PlanWarning.of(SCAN_WITH_PREDICATE,
                    "Scan with residual predicate - SQL Server is reading every row and filtering after the fact. "
                            + "Create an index on the predicate columns. Predicate: " + truncate(node.getPredicate()),
                    WarningSeverity.WARNING));
        }
        return List.of();
    }

    private String truncate(String predicate) {
        return RuleSupport.truncate(predicate, thresholds.getPredicateDisplayLength());
    }
}
