package org.carball.showplan.analyzer.rules;

import lombok.RequiredArgsConstructor;
import org.carball.showplan.analyzer.StatementRule;
import org.carball.showplan.config.AnalyzerThresholds;
import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.model.plan.PlanWarning;
import org.carball.showplan.model.plan.WarningSeverity;

import java.util.List;

@RequiredArgsConstructor
public class HighCompileCpuRule implements StatementRule {

    private final AnalyzerThresholds thresholds;

    @Override
    public List<PlanWarning> evaluate(PlanStatement statement) {
        long compileCpu = statement.getCompileCpuMs();
        if (compileCpu < thresholds.getCompileCpuWarningMs()) {
            return List.of();
        }
        WarningSeverity severity = compileCpu >= thresholds.getCompileCpuCriticalMs()
                ? WarningSeverity.CRITICAL
                : WarningSeverity.WARNING;
        return List.of(PlanWarning.of("High Compile CPU",
                "Query took " + RuleSupport.number(compileCpu) + "ms of CPU just to compile a plan "
                        + "(before any data was read). Simplify the query by breaking it into smaller steps "
                        + "using #temp tables.",
                severity));
    }
}
