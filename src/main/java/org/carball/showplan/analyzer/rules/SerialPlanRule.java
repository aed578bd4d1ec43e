package org.carball.showplan.analyzer.rules;

import org.carball.showplan.analyzer.StatementRule;
import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.model.plan.PlanWarning;
import org.carball.showplan.model.plan.WarningSeverity;

import java.util.List;

/**
 * Reports why the optimizer produced a serial plan.
 */
public class SerialPlanRule implements StatementRule {

    @Override
    public List<PlanWarning> evaluate(PlanStatement statement) {
        String reasonCode = statement.getNonParallelPlanReason();
        if (RuleSupport.isNullOrEmpty(reasonCode)) {
            return List.of();
        }
        return List.of(PlanWarning.of("Serial Plan",
                "Query running serially: " + explain(reasonCode) + ".",
                WarningSeverity.WARNING));
    }

    static String explain(String reasonCode) {
        return switch (reasonCode) {
            case "MaxDOPSetToOne" -> "MAXDOP is set to 1";
            case "EstimatedDOPIsOne" ->
                    "Estimated DOP is 1 (the plan's estimated cost was below the cost threshold for parallelism)";
            case "NoParallelPlansInDesktopOrExpressEdition" -> "Express/Desktop edition does not support parallelism";
            case "CouldNotGenerateValidParallelPlan" ->
                    "Optimizer could not generate a valid parallel plan. Common causes: scalar UDFs, "
                            + "inserts into table variables, certain system functions, or OPTION (MAXDOP 1) hints";
            case "QueryHintNoParallelSet" -> "OPTION (MAXDOP 1) hint forces serial execution";
            default -> reasonCode;
        };
    }
}
