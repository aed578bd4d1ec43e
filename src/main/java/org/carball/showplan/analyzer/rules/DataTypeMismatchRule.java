package org.carball.showplan.analyzer.rules;

import org.carball.showplan.analyzer.NodeRule;
import org.carball.showplan.model.plan.PlanNode;
import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.model.plan.PlanWarning;
import org.carball.showplan.model.plan.WarningSeverity;

import java.util.List;

/**
 * Compute Scalars that build a seek range through GetRangeWithMismatchedTypes or
 * GetRangeThroughConvert.
 */
public class DataTypeMismatchRule implements NodeRule {

    @Override
    public List<PlanWarning> evaluate(PlanNode node, PlanStatement statement) {
        String definedValues = node.getDefinedValues();
        if (!node.isPhysicalOp("Compute Scalar") || RuleSupport.isNullOrEmpty(definedValues)) {
            return List.of();
        }

        String message;
        if (RuleSupport.containsIgnoreCase(definedValues, "GetRangeWithMismatchedTypes")) {
            message = "Mismatched data types between the column and the parameter/literal. SQL Server is "
                    + "converting every row to compare, preventing index seeks. Match your data types - don't pass "
                    + "nvarchar to a varchar column, or int to a bigint column.";
        } else if (RuleSupport.containsIgnoreCase(definedValues, "GetRangeThroughConvert")) {
            message = "CONVERT/CAST wrapping a column in the predicate. SQL Server is converting every row to "
                    + "compare, preventing index seeks. Match your data types - convert the parameter/literal "
                    + "instead of the column.";
        } else {
            return List.of();
        }
        return List.of(PlanWarning.of("Data Type Mismatch", message, WarningSeverity.WARNING));
    }
}
