package org.carball.showplan.analyzer.rules;

import org.carball.showplan.analyzer.StatementRule;
import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.model.plan.PlanWarning;
import org.carball.showplan.model.plan.WarningSeverity;

import java.util.List;

public class CompileMemoryExceededRule implements StatementRule {

    static final String MEMORY_LIMIT_EXCEEDED = "MemoryLimitExceeded";

    @Override
    public List<PlanWarning> evaluate(PlanStatement statement) {
        if (!MEMORY_LIMIT_EXCEEDED.equals(statement.getEarlyAbortReason())) {
            return List.of();
        }
        return List.of(PlanWarning.of("Compile Memory Exceeded",
                "Optimization was aborted early because the compile memory limit was exceeded. "
                        + "The plan is likely suboptimal. Simplify the query by breaking it into smaller steps "
                        + "using #temp tables.",
                WarningSeverity.CRITICAL));
    }
}
