package org.carball.showplan.analyzer.rules;

import org.carball.showplan.analyzer.StatementRule;
import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.model.plan.PlanWarning;
import org.carball.showplan.model.plan.WarningSeverity;

import java.util.List;
import java.util.regex.Pattern;

public class OptimizeForUnknownRule implements StatementRule {

    private static final Pattern OPTIMIZE_FOR_UNKNOWN =
            Pattern.compile("OPTIMIZE\\s+FOR\\s+UNKNOWN", Pattern.CASE_INSENSITIVE);

    @Override
    public List<PlanWarning> evaluate(PlanStatement statement) {
        String text = statement.getStatementText();
        if (RuleSupport.isNullOrEmpty(text) || !OPTIMIZE_FOR_UNKNOWN.matcher(text).find()) {
            return List.of();
        }
        return List.of(PlanWarning.of("Optimize For Unknown",
                "OPTIMIZE FOR UNKNOWN forces average density estimates for all parameters instead of using the "
                        + "actual sniffed values. This rarely produces a better plan - it just trades one bad "
                        + "estimate for a different bad estimate. Address the root cause: add better indexes so "
                        + "the plan is less sensitive to parameter values, use OPTION (RECOMPILE) for volatile "
                        + "parameters, or restructure the query.",
                WarningSeverity.WARNING));
    }
}
