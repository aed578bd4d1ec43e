package org.carball.showplan.analyzer.rules;

import org.carball.showplan.analyzer.StatementRule;
import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.model.plan.PlanWarning;
import org.carball.showplan.model.plan.WarningSeverity;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Common table expressions referenced more than once as a FROM or JOIN target.
 * Each reference re-executes the CTE.
 */
public class CteMultipleReferencesRule implements StatementRule {

    private static final Pattern CTE_DEFINITION =
            Pattern.compile("(?:\\bWITH\\s+|,\\s*)(\\w+)\\s+AS\\s*\\(", Pattern.CASE_INSENSITIVE);

    @Override
    public List<PlanWarning> evaluate(PlanStatement statement) {
        String text = statement.getStatementText();
        if (RuleSupport.isNullOrEmpty(text)) {
            return List.of();
        }

        List<PlanWarning> warnings = new ArrayList<>();
        Matcher definitions = CTE_DEFINITION.matcher(text);
        while (definitions.find()) {
            String cteName = definitions.group(1);
            int references = countReferences(text, cteName);
            if (references > 1) {
                warnings.add(PlanWarning.of("CTE Multiple References",
                        "CTE \"" + cteName + "\" is referenced " + references + " times. SQL Server re-executes "
                                + "the entire CTE each time - it does not materialize the results. "
                                + "Materialize into a #temp table instead.",
                        WarningSeverity.WARNING));
            }
        }
        return warnings;
    }

    static int countReferences(String text, String cteName) {
        Pattern reference = Pattern.compile("\\b(FROM|JOIN)\\s+" + Pattern.quote(cteName) + "\\b",
                Pattern.CASE_INSENSITIVE);
        Matcher matcher = reference.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
