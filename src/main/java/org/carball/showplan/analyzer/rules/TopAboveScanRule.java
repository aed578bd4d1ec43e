package org.carball.showplan.analyzer.rules;

import org.carball.showplan.analyzer.NodeRule;
import org.carball.showplan.model.plan.PlanNode;
import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.model.plan.PlanWarning;
import org.carball.showplan.model.plan.WarningSeverity;

import java.util.List;

/**
 * A Top on the inner side of Nested Loops that reads from a scan: the scan is a
 * linear search repeated once per outer row. Evaluated at the Top, looking up
 * through Compute Scalars for the join and down through them for the scan.
 */
public class TopAboveScanRule implements NodeRule {

    @Override
    public List<PlanWarning> evaluate(PlanNode node, PlanStatement statement) {
        if (!node.isPhysicalOp("Top") || node.getChildren().isEmpty()) {
            return List.of();
        }

        PlanNode join = innerSideJoin(node);
        if (join == null) {
            return List.of();
        }

        PlanNode scan = RuleSupport.skipComputeScalars(node.getChildren().get(0));
        if (!RuleSupport.isScanOperator(scan)) {
            return List.of();
        }

        String predicateNote = scan.hasPredicate()
                ? " The scan has a residual predicate, so it may read many rows before the Top is satisfied."
                : "";
        return List.of(PlanWarning.of("Top Above Scan",
                "Top operator reads from " + scan.getPhysicalOp() + " (Node " + scan.getNodeId()
                        + ") on the inner side of Nested Loops (Node " + join.getNodeId() + ")." + predicateNote
                        + " Create an index on the predicate columns to convert the scan into a seek.",
                WarningSeverity.WARNING));
    }

    /**
     * @return the Nested Loops whose second child leads to this Top along a chain
     *         of first-child Compute Scalars, or null
     */
    private static PlanNode innerSideJoin(PlanNode top) {
        PlanNode current = top;
        PlanNode parent = current.getParent();
        while (parent != null && parent.isPhysicalOp("Compute Scalar") && parent.child(0) == current) {
            current = parent;
            parent = current.getParent();
        }
        if (parent == null || !parent.isPhysicalOp("Nested Loops") || parent.getChildren().size() < 2) {
            return null;
        }
        return parent.child(1) == current ? parent : null;
    }
}
