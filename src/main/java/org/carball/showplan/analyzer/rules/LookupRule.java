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
 * RID lookups into heaps, and key lookups that carry a residual predicate. A RID
 * Lookup also reports lookup=true, so it is checked first.
 */
@RequiredArgsConstructor
public class LookupRule implements NodeRule {

    private final AnalyzerThresholds thresholds;

    @Override
    public List<PlanWarning> evaluate(PlanNode node, PlanStatement statement) {
        if (node.isPhysicalOp("RID Lookup")) {
            String message = "RID Lookup - this table is a heap (no clustered index). SQL Server found rows via a "
                    + "nonclustered index but had to follow row identifiers back to unordered heap pages. Heap "
                    + "lookups are more expensive than key lookups because pages are not sorted and may have "
                    + "forwarding pointers. Add a clustered index to the table.";
            if (node.hasPredicate()) {
                message += " Predicate: " + truncate(node.getPredicate());
            }
            return List.of(PlanWarning.of("RID Lookup", message, WarningSeverity.WARNING));
        }

        if (node.isLookup() && node.hasPredicate()) {
            return List.of(PlanWarning.of("Key Lookup",
                    "Key Lookup - SQL Server found rows via a nonclustered index but had to go back to the "
                            + "clustered index for additional columns. Alter the nonclustered index to add the "
                            + "predicate column as a key column or as an INCLUDE column. Predicate: "
                            + truncate(node.getPredicate()),
                    WarningSeverity.WARNING));
        }
        return List.of();
    }

    private String truncate(String predicate) {
        return RuleSupport.truncate(predicate, thresholds.getPredicateDisplayLength());
    }
}
