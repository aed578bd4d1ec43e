package org.carball.showplan.analyzer.rules;

import lombok.RequiredArgsConstructor;
import org.carball.showplan.analyzer.NodeRule;
import org.carball.showplan.config.AnalyzerThresholds;
import org.carball.showplan.model.plan.PlanNode;
import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.model.plan.PlanWarning;
import org.carball.showplan.model.plan.WarningSeverity;

import java.util.List;
import java.util.regex.Pattern;

/**
 * NOT IN against a nullable column: a Row Count Spool rewound once per outer row
 * below an Anti Semi Join that checks IS NULL.
 */
@RequiredArgsConstructor
public class RowCountSpoolRule implements NodeRule {

    private static final Pattern NOT_IN = Pattern.compile("\\bNOT\\s+IN\\b", Pattern.CASE_INSENSITIVE);

    private final AnalyzerThresholds thresholds;

    @Override
    public List<PlanWarning> evaluate(PlanNode node, PlanStatement statement) {
        if (!node.isPhysicalOp("Row Count Spool")) {
            return List.of();
        }

        double rewinds = node.hasActualStats() ? node.getActualRewinds() : node.getEstimateRewinds();
        if (rewinds <= thresholds.getRowCountSpoolWarningRewinds() || !hasNotInPattern(node, statement)) {
            return List.of();
        }

        WarningSeverity severity = rewinds > thresholds.getRowCountSpoolCriticalRewinds()
                ? WarningSeverity.CRITICAL
                : WarningSeverity.WARNING;
        return List.of(PlanWarning.of("Row Count Spool (NOT IN)",
                "Row Count Spool with " + RuleSupport.number(rewinds) + " rewinds. This pattern occurs when NOT IN "
                        + "is used with a nullable column - SQL Server cannot use an efficient Anti Semi Join because "
                        + "it must check for NULL values on every outer row. Rewrite as NOT EXISTS, or add WHERE "
                        + "column IS NOT NULL to the subquery.",
                severity));
    }

    static boolean hasNotInPattern(PlanNode spool, PlanStatement statement) {
        String text = statement.getStatementText();
        if (RuleSupport.isNullOrEmpty(text) || !NOT_IN.matcher(text).find()) {
            return false;
        }
        for (PlanNode ancestor = spool.getParent(); ancestor != null; ancestor = ancestor.getParent()) {
            if (ancestor.isPhysicalOp("Nested Loops")
                    && RuleSupport.containsIgnoreCase(ancestor.getLogicalOp(), "Anti Semi")
                    && RuleSupport.containsIgnoreCase(ancestor.getPredicate(), "IS NULL")) {
                return true;
            }
        }
        return false;
    }
}
