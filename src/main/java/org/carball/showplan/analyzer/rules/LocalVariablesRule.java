package org.carball.showplan.analyzer.rules;

import org.carball.showplan.analyzer.StatementRule;
import org.carball.showplan.model.plan.PlanParameter;
import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.model.plan.PlanWarning;
import org.carball.showplan.model.plan.WarningSeverity;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Parameters without a compiled value are local variables the optimizer could not sniff.
 */
public class LocalVariablesRule implements StatementRule {

    @Override
    public List<PlanWarning> evaluate(PlanStatement statement) {
        List<String> unsniffed = statement.getParameters().stream()
                .filter(parameter -> RuleSupport.isNullOrEmpty(parameter.compiledValue()))
                .map(PlanParameter::name)
                .collect(Collectors.toList());
        if (unsniffed.isEmpty() || RuleSupport.containsIgnoreCase(statement.getStatementText(), "RECOMPILE")) {
            return List.of();
        }

        return List.of(PlanWarning.of("Local Variables",
                "Local variables detected: " + String.join(", ", unsniffed) + ". SQL Server cannot sniff local "
                        + "variable values at compile time, so it uses average density estimates instead of your "
                        + "actual values. Test with OPTION (RECOMPILE) to see if the plan improves. For a permanent "
                        + "fix, use dynamic SQL or a stored procedure to pass the values as parameters instead of "
                        + "local variables.",
                WarningSeverity.WARNING));
    }
}
