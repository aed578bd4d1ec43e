package org.carball.showplan.analyzer.rules;

import lombok.RequiredArgsConstructor;
import org.carball.showplan.analyzer.StatementRule;
import org.carball.showplan.config.AnalyzerThresholds;
import org.carball.showplan.model.plan.MemoryGrantInfo;
import org.carball.showplan.model.plan.PlanNode;
import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.model.plan.PlanWarning;
import org.carball.showplan.model.plan.WarningSeverity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Flags large grants and names the Sort and Hash operators that asked for the memory.
 */
@RequiredArgsConstructor
public class LargeMemoryGrantRule implements StatementRule {

    private final AnalyzerThresholds thresholds;

    @Override
    public List<PlanWarning> evaluate(PlanStatement statement) {
        MemoryGrantInfo grant = statement.getMemoryGrant();
        if (grant == null || grant.getGrantedMemoryKb() < thresholds.getLargeGrantKb() || !statement.hasRootNode()) {
            return List.of();
        }

        List<String> consumers = new ArrayList<>();
        statement.getRootNode().walk(node -> {
            String consumer = describeConsumer(node);
            if (consumer != null) {
                consumers.add(consumer);
            }
        });

        double grantMb = grant.getGrantedMemoryKb() / 1024.0;
        String guidance = consumers.isEmpty()
                ? ""
                : " Memory consumers: " + String.join(", ", consumers)
                        + ". Check whether these operators are processing more rows than necessary.";
        WarningSeverity severity = grant.getGrantedMemoryKb() >= thresholds.getCriticalGrantKb()
                ? WarningSeverity.CRITICAL
                : WarningSeverity.WARNING;

        return List.of(PlanWarning.of("Large Memory Grant",
                String.format(Locale.US, "Query granted %.0f MB of memory.%s", grantMb, guidance),
                severity));
    }

    private static String describeConsumer(PlanNode node) {
        String label;
        if (node.physicalOpContains("Sort") && !node.physicalOpContains("Spool")) {
            label = "Sort";
        } else if (node.physicalOpContains("Hash")) {
            label = "Hash Match";
        } else {
            return null;
        }
        String rows = node.hasActualStats()
                ? RuleSupport.number(node.getActualRows()) + " actual rows"
                : RuleSupport.number(node.getEstimateRows()) + " estimated rows";
        return label + " (Node " + node.getNodeId() + ", " + rows + ")";
    }
}
