package org.carball.showplan.analyzer.rules;

import lombok.RequiredArgsConstructor;
import org.carball.showplan.analyzer.StatementRule;
import org.carball.showplan.config.AnalyzerThresholds;
import org.carball.showplan.model.plan.MemoryGrantInfo;
import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.model.plan.PlanWarning;
import org.carball.showplan.model.plan.WarningSeverity;

import java.util.List;

@RequiredArgsConstructor
public class MemoryGrantWaitRule implements StatementRule {

    private final AnalyzerThresholds thresholds;

    @Override
    public List<PlanWarning> evaluate(PlanStatement statement) {
        MemoryGrantInfo grant = statement.getMemoryGrant();
        if (grant == null || grant.getGrantWaitTimeMs() <= 0) {
            return List.of();
        }

        long waitMs = grant.getGrantWaitTimeMs();
        WarningSeverity severity = waitMs >= thresholds.getGrantWaitCriticalMs()
                ? WarningSeverity.CRITICAL
                : WarningSeverity.WARNING;
        return List.of(PlanWarning.of("Memory Grant Wait",
                "Query waited " + RuleSupport.number(waitMs) + "ms for a memory grant before it could start running. "
                        + "Other queries were using all available workspace memory.",
                severity));
    }
}
