package org.carball.showplan.analyzer.rules;

import lombok.RequiredArgsConstructor;
import org.carball.showplan.analyzer.WarningAdjuster;
import org.carball.showplan.config.AnalyzerThresholds;
import org.carball.showplan.model.plan.PlanNode;
import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.model.plan.PlanWarning;
import org.carball.showplan.model.plan.SpillDetail;
import org.carball.showplan.model.plan.SpillKind;
import org.carball.showplan.model.plan.WarningSeverity;

/**
 * Grades spill warnings. Sort and hash spills are graded by the operator's share
 * of statement elapsed time. Exchange spills are graded by TempDB writes since
 * Parallelism timings are unreliable.
 */
@RequiredArgsConstructor
public class SpillSeverityAdjuster implements WarningAdjuster {

    private final AnalyzerThresholds thresholds;

    @Override
    public void adjust(PlanNode node, PlanStatement statement) {
        long statementMs = statement.getElapsedTimeMs();
        for (PlanWarning warning : node.getWarnings()) {
            SpillDetail spill = warning.getSpillDetail();
            if (spill == null) {
                continue;
            }
            if (spill.kind() == SpillKind.EXCHANGE) {
                adjustExchangeSpill(warning, spill, node, statementMs);
            } else if (node.getActualElapsedMs() > 0) {
                adjustOperatorSpill(warning, node, statementMs);
            }
        }
    }

    private void adjustExchangeSpill(PlanWarning warning, SpillDetail spill, PlanNode node, long statementMs) {
        long writes = spill.writesToTempDb();
        if (writes >= thresholds.getExchangeSpillCriticalWrites()) {
            warning.setSeverity(WarningSeverity.CRITICAL);
        } else if (writes >= thresholds.getExchangeSpillWarningWrites()) {
            warning.setSeverity(WarningSeverity.WARNING);
        }

        if (node.getActualElapsedMs() > 0) {
            long operatorMs = parallelismElapsedMs(node);
            if (statementMs > 0 && operatorMs > 0) {
                appendOperatorTime(warning, operatorMs, statementMs);
            }
        }
    }

    private void adjustOperatorSpill(PlanWarning warning, PlanNode node, long statementMs) {
        if (statementMs <= 0) {
            return;
        }
        long operatorMs = ownElapsedMs(node);
        double share = appendOperatorTime(warning, operatorMs, statementMs);
        if (share >= thresholds.getSpillCriticalFraction()) {
            warning.setSeverity(WarningSeverity.CRITICAL);
        } else if (share >= thresholds.getSpillWarningFraction()) {
            warning.setSeverity(WarningSeverity.WARNING);
        }
    }

    private static double appendOperatorTime(PlanWarning warning, long operatorMs, long statementMs) {
        double share = (double) operatorMs / statementMs;
        warning.setMessage(warning.getMessage() + " Operator time: " + RuleSupport.number(operatorMs) + "ms ("
                + RuleSupport.percent(share) + " of statement).");
        return share;
    }

    /**
     * Batch mode times are per operator. Row mode times include the children, so
     * the slowest child is subtracted, looking through Parallelism children.
     */
    static long ownElapsedMs(PlanNode node) {
        if ("Batch".equals(node.getActualExecutionMode())) {
            return node.getActualElapsedMs();
        }
        long maxChild = 0;
        for (PlanNode child : node.getChildren()) {
            long childMs = child.getActualElapsedMs();
            if (child.isPhysicalOp("Parallelism") && !child.getChildren().isEmpty()) {
                childMs = maxElapsed(child);
            }
            maxChild = Math.max(maxChild, childMs);
        }
        return Math.max(0, node.getActualElapsedMs() - maxChild);
    }

    static long parallelismElapsedMs(PlanNode node) {
        if (node.getChildren().isEmpty()) {
            return node.getActualElapsedMs();
        }
        return Math.max(0, node.getActualElapsedMs() - maxElapsed(node));
    }

    private static long maxElapsed(PlanNode parent) {
        return parent.getChildren().stream().mapToLong(PlanNode::getActualElapsedMs).max().orElse(0);
    }
}
