package org.carball.showplan.model.plan;

/**
 * A parameter or local variable from the plan's parameter list.
 * A missing compiled value means the optimizer could not sniff it.
 */
public record PlanParameter(
        String name,
        String dataType,
        String compiledValue,
        String runtimeValue
) {
    public boolean isSniffed() {
        return compiledValue != null && !compiledValue.isEmpty();
    }
}
