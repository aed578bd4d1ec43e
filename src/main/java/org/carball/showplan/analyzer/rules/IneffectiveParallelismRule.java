package org.carball.showplan.analyzer.rules;

import lombok.RequiredArgsConstructor;
import org.carball.showplan.analyzer.StatementRule;
import org.carball.showplan.config.AnalyzerThresholds;
import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.model.plan.PlanWarning;
import org.carball.showplan.model.plan.QueryTimeStats;
import org.carball.showplan.model.plan.WarningSeverity;

import java.util.List;

/**
 * Parallel plans whose CPU time barely exceeds elapsed time ran effectively serially.
 */
@RequiredArgsConstructor
public class IneffectiveParallelismRule implements StatementRule {

    private final AnalyzerThresholds thresholds;

    @Override
    public List<PlanWarning> evaluate(PlanStatement statement) {
        QueryTimeStats timeStats = statement.getQueryTimeStats();
        if (statement.getDegreeOfParallelism() <= 1 || timeStats == null) {
            return List.of();
        }

        long cpu = timeStats.cpuTimeMs();
        long elapsed = timeStats.elapsedTimeMs();
        if (elapsed < thresholds.getParallelismMinElapsedMs() || cpu <= 0) {
            return List.of();
        }
        if ((double) cpu / elapsed > thresholds.getParallelismCpuRatio()) {
            return List.of();
        }

        return List.of(PlanWarning.of("Ineffective Parallelism",
                "Parallel plan (DOP " + statement.getDegreeOfParallelism() + ") but CPU time ("
                        + RuleSupport.number(cpu) + "ms) is nearly equal to elapsed time ("
                        + RuleSupport.number(elapsed) + "ms). The work ran essentially serially despite the "
                        + "overhead of parallelism. Look for parallel thread skew, blocking exchanges, or serial "
                        + "zones in the plan that prevent effective parallel execution.",
                WarningSeverity.WARNING));
    }
}
