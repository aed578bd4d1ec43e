package org.carball.showplan.analyzer;

import org.carball.showplan.model.plan.PlanStatement;
import org.carball.showplan.model.plan.PlanWarning;

import java.util.List;

/**
 * A check over statement-level metadata and text.
 */
public interface StatementRule {

    /**
     * @return the findings for this statement, empty when the rule does not apply
     */
    List<PlanWarning> evaluate(PlanStatement statement);

    default String name() {
        return getClass().getSimpleName();
    }
}
