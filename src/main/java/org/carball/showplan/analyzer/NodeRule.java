package org.carball.showplan.analyzer;

import org.carball.showplan.model.plan.PlanNode;
import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.model.plan.PlanWarning;

import java.util.List;

/**
 * A check run at every operator of a statement's tree. Findings returned are
 * attached to the node being evaluated.
 */
public interface NodeRule {

    List<PlanWarning> evaluate(PlanNode node, PlanStatement statement);

    default String name() {
        return getClass().getSimpleName();
    }
}
