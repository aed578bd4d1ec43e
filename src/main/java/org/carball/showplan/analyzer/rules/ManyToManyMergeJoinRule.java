package org.carball.showplan.analyzer.rules;

import org.carball.showplan.analyzer.NodeRule;
import org.carball.showplan.model.plan.PlanNode;
import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.model.plan.PlanWarning;
import org.carball.showplan.model.plan.WarningSeverity;

import java.util.List;

/**
 * Many-to-many merge joins use a TempDB worktable. In actual plans the worktable
 * shows up as logical reads on the join; with none the finding is skipped.
 */
public class ManyToManyMergeJoinRule implements NodeRule {

    @Override
    public List<PlanWarning> evaluate(PlanNode node, PlanStatement statement) {
        if (!node.isManyToMany() || !node.physicalOpContains("Merge")) {
            return List.of();
        }
        if (node.hasActualStats() && node.getActualLogicalReads() <= 0) {
            return List.of();
        }

        String message = node.hasActualStats()
                ? "Many-to-many Merge Join - SQL Server created a worktable in TempDB ("
                        + RuleSupport.number(node.getActualLogicalReads())
                        + " logical reads) because both sides have duplicate values in the join columns."
                : "Many-to-many Merge Join - SQL Server will create a worktable in TempDB because both sides have "
                        + "duplicate values in the join columns.";
        return List.of(PlanWarning.of("Many-to-Many Merge Join", message, WarningSeverity.WARNING));
    }
}
