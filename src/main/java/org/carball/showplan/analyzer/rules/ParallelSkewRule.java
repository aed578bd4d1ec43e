package org.carball.showplan.analyzer.rules;

import lombok.RequiredArgsConstructor;
import org.carball.showplan.analyzer.NodeRule;
import org.carball.showplan.config.AnalyzerThresholds;
import org.carball.showplan.model.plan.PlanNode;
import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.model.plan.PlanWarning;
import org.carball.showplan.model.plan.ThreadCounters;
import org.carball.showplan.model.plan.WarningSeverity;

import java.util.List;

/**
 * One thread doing most of the work of a parallel operator. Only considered once
 * there are enough rows to spread across the threads.
 */
@RequiredArgsConstructor
public class ParallelSkewRule implements NodeRule {

    private final AnalyzerThresholds thresholds;

    @Override
    public List<PlanWarning> evaluate(PlanNode node, PlanStatement statement) {
        List<ThreadCounters> threads = node.getThreadCounters();
        if (threads.size() <= 1) {
            return List.of();
        }

        long totalRows = threads.stream().mapToLong(ThreadCounters::actualRows).sum();
        if (totalRows < threads.size() * thresholds.getSkewMinRowsPerThread()) {
            return List.of();
        }

        // first thread wins ties
        ThreadCounters busiest = threads.get(0);
        for (ThreadCounters thread : threads) {
            if (thread.actualRows() > busiest.actualRows()) {
                busiest = thread;
            }
        }

        double share = (double) busiest.actualRows() / totalRows;
        double limit = threads.size() == 2 ? thresholds.getSkewTwoThreadThreshold() : thresholds.getSkewThreshold();
        if (share < limit) {
            return List.of();
        }

        return List.of(PlanWarning.of("Parallel Skew",
                "Thread " + busiest.threadId() + " processed " + RuleSupport.percent(share) + " of rows ("
                        + RuleSupport.number(busiest.actualRows()) + "/" + RuleSupport.number(totalRows)
                        + "). Work is heavily skewed to one thread, so parallelism isn't helping much.",
                WarningSeverity.WARNING));
    }
}
