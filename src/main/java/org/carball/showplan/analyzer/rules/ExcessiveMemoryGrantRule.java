package org.carball.showplan.analyzer.rules;

import lombok.RequiredArgsConstructor;
import org.carball.showplan.analyzer.StatementRule;
import org.carball.showplan.config.AnalyzerThresholds;
import org.carball.showplan.model.plan.MemoryGrantInfo;
import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.model.plan.PlanWarning;
import org.carball.showplan.model.plan.WarningSeverity;

import java.util.List;
import java.util.Locale;

/**
 * Large grants where only a small fraction of the memory was actually used.
 */
@RequiredArgsConstructor
public class ExcessiveMemoryGrantRule implements StatementRule {

    private final AnalyzerThresholds thresholds;

    @Override
    public List<PlanWarning> evaluate(PlanStatement statement) {
        MemoryGrantInfo grant = statement.getMemoryGrant();
        if (grant == null || grant.getGrantedMemoryKb() <= 0 || grant.getMaxUsedMemoryKb() <= 0) {
            return List.of();
        }

        double wasteRatio = (double) grant.getGrantedMemoryKb() / grant.getMaxUsedMemoryKb();
        if (wasteRatio < thresholds.getExcessiveGrantRatio() || grant.getGrantedMemoryKb() < thresholds.getLargeGrantKb()) {
            return List.of();
        }

        String message = String.format(Locale.US,
                "Granted %,d KB but only used %,d KB (%.0fx overestimate). "
                        + "The unused memory is reserved and unavailable to other queries.",
                grant.getGrantedMemoryKb(), grant.getMaxUsedMemoryKb(), wasteRatio);
        return List.of(PlanWarning.of("Excessive Memory Grant", message, WarningSeverity.WARNING));
    }
}
