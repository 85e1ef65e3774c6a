package org.carball.showplan.model.plan;

/**
 * A statement parameter with the value the plan was compiled for and, in actual plans, the value it ran with.
 */
public record PlanParameter(String name, String dataType, String compiledValue, String runtimeValue) {

    public boolean isSniffed() {
        return compiledValue != null && runtimeValue != null && !compiledValue.equals(runtimeValue);
    }
}
