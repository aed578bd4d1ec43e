package org.carball.showplan.analyzer.rules;

import lombok.RequiredArgsConstructor;
import org.carball.showplan.analyzer.NodeRule;
import org.carball.showplan.config.AnalyzerThresholds;
import org.carball.showplan.model.plan.PlanNode;
import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.model.plan.PlanWarning;
import org.carball.showplan.model.plan.WarningSeverity;

import java.util.List;
import java.util.Locale;

/**
 * Lazy spools whose cache is rarely reused. Rebinds are cache misses, rewinds
 * are cache hits.
 */
@RequiredArgsConstructor
public class LazySpoolRule implements NodeRule {

    private final AnalyzerThresholds thresholds;

    @Override
    public List<PlanWarning> evaluate(PlanNode node, PlanStatement statement) {
        if (!"Lazy Spool".equals(node.getLogicalOp())) {
            return List.of();
        }

        boolean actual = node.hasActualStats();
        double rebinds = actual ? node.getActualRebinds() : node.getEstimateRebinds();
        double rewinds = actual ? node.getActualRewinds() : node.getEstimateRewinds();
        if (rebinds <= thresholds.getLazySpoolMinRebinds() || rewinds >= rebinds * thresholds.getLazySpoolRewindRatio()) {
            return List.of();
        }

        String ratio = rewinds > 0
                ? String.format(Locale.US, "%.1fx rewinds (cache hits) per rebind (cache miss)", rewinds / rebinds)
                : "no rewinds (cache hits) at all";
        WarningSeverity severity = rewinds < rebinds ? WarningSeverity.CRITICAL : WarningSeverity.WARNING;
        return List.of(PlanWarning.of("Lazy Spool Ineffective",
                "Lazy spool has low cache hit ratio (" + (actual ? "actual" : "estimated") + "): "
                        + RuleSupport.number(rebinds) + " rebinds (cache misses), " + RuleSupport.number(rewinds)
                        + " rewinds (cache hits) - " + ratio + ". The spool is caching results but rarely reusing "
                        + "them, adding overhead for no benefit.",
                severity));
    }
}
