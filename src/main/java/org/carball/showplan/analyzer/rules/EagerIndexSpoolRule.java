package org.carball.showplan.analyzer.rules;

import org.carball.showplan.analyzer.NodeRule;
import org.carball.showplan.model.plan.PlanNode;
import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.model.plan.PlanWarning;
import org.carball.showplan.model.plan.WarningSeverity;

import java.util.List;

/**
 * Eager index spools build a throwaway index in TempDB on every execution. The
 * decoder's suggested index is appended when one could be derived.
 */
public class EagerIndexSpoolRule implements NodeRule {

    @Override
    public List<PlanWarning> evaluate(PlanNode node, PlanStatement statement) {
        if (!"Eager Spool".equals(node.getLogicalOp()) || !node.physicalOpContains("Spool")) {
            return List.of();
        }

        String message = "SQL Server is building a temporary index in TempDB at runtime because no suitable "
                + "permanent index exists. This is expensive - it builds the index from scratch on every execution. "
                + "Create a permanent index on the underlying table to eliminate this operator entirely.";
        if (!RuleSupport.isNullOrEmpty(node.getSuggestedIndex())) {
            message += "\n\nCreate this index:\n" + node.getSuggestedIndex();
        }
        return List.of(PlanWarning.of("Eager Index Spool", message, WarningSeverity.CRITICAL));
    }
}
