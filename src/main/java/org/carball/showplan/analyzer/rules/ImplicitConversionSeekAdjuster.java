package org.carball.showplan.analyzer.rules;

import org.carball.showplan.analyzer.WarningAdjuster;
import org.carball.showplan.model.plan.PlanNode;
import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.model.plan.PlanWarning;
import org.carball.showplan.model.plan.WarningSeverity;
import org.carball.showplan.parser.PlanWarningParser;

/**
 * An implicit conversion that affected the seek plan turned a seek into a scan.
 */
public class ImplicitConversionSeekAdjuster implements WarningAdjuster {

    static final String SEEK_PLAN_PREFIX = "Implicit conversion prevented an index seek, forcing a scan instead. "
            + "Fix the data type mismatch: ensure the parameter or variable type matches the column type exactly. ";

    @Override
    public void adjust(PlanNode node, PlanStatement statement) {
        for (PlanWarning warning : node.getWarnings()) {
            if (PlanWarningParser.IMPLICIT_CONVERSION.equals(warning.getCategory())
                    && warning.getMessage() != null
                    && warning.getMessage().startsWith("Seek Plan")) {
                warning.setSeverity(WarningSeverity.CRITICAL);
                warning.setMessage(SEEK_PLAN_PREFIX + warning.getMessage());
            }
        }
    }
}
