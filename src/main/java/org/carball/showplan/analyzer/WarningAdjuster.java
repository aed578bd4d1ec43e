package org.carball.showplan.analyzer;

import org.carball.showplan.model.plan.PlanNode;
import org.carball.showplan.model.plan.PlanStatement;

/**
 * Revisits warnings already on a node and escalates severity or extends the
 * message in place.
 */
public interface WarningAdjuster {

    void adjust(PlanNode node, PlanStatement statement);

    default String name() {
        return getClass().getSimpleName();
    }
}
