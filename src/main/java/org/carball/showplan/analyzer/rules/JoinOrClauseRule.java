package org.carball.showplan.analyzer.rules;

import org.carball.showplan.analyzer.NodeRule;
import org.carball.showplan.model.plan.PlanNode;
import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.model.plan.PlanWarning;
import org.carball.showplan.model.plan.WarningSeverity;

import java.util.List;

/**
 * OR in a join predicate, recognised by its expansion shape:
 * Nested Loops, Merge Interval, TopN Sort, optional Compute Scalars, then a
 * Concatenation over two or more Constant Scan branches.
 */
public class JoinOrClauseRule implements NodeRule {

    @Override
    public List<PlanWarning> evaluate(PlanNode node, PlanStatement statement) {
        if (!node.isPhysicalOp("Concatenation")) {
            return List.of();
        }

        long branches = node.getChildren().stream()
                .filter(JoinOrClauseRule::isConstantScanBranch)
                .count();
        if (branches < 2 || !isOrExpansionChain(node)) {
            return List.of();
        }

        return List.of(PlanWarning.of("Join OR Clause",
                "OR in a join predicate. SQL Server rewrote the OR as " + branches + " separate lookups, each "
                        + "evaluated independently - this multiplies the work on the inner side. Rewrite as separate "
                        + "queries joined with UNION ALL. For example, change \"FROM a JOIN b ON a.x = b.x OR a.y = b.y\" "
                        + "to \"FROM a JOIN b ON a.x = b.x UNION ALL FROM a JOIN b ON a.y = b.y\".",
                WarningSeverity.WARNING));
    }

    private static boolean isConstantScanBranch(PlanNode child) {
        if (child.isPhysicalOp("Constant Scan")) {
            return true;
        }
        return child.isPhysicalOp("Compute Scalar")
                && child.getChildren().stream().anyMatch(grandchild -> grandchild.isPhysicalOp("Constant Scan"));
    }

    static boolean isOrExpansionChain(PlanNode concatenation) {
        PlanNode parent = concatenation.getParent();
        while (parent != null && parent.isPhysicalOp("Compute Scalar")) {
            parent = parent.getParent();
        }
        if (parent == null || !"TopN Sort".equals(parent.getLogicalOp())) {
            return false;
        }
        parent = parent.getParent();
        if (parent == null || !parent.isPhysicalOp("Merge Interval")) {
            return false;
        }
        parent = parent.getParent();
        return parent != null && parent.isPhysicalOp("Nested Loops");
    }
}
