package com.company.decommissioning.domain.enums;

/**
 * How deeply a database is wired into other systems.
 */
public enum ScenarioType {
    CONFIG_ONLY(Criticality.LOW),
    MIXED(Criticality.MEDIUM),
    LOGIC_HEAVY(Criticality.CRITICAL);

    private final Criticality baseline;

    ScenarioType(Criticality baseline) {
        this.baseline = baseline;
    }

    /**
     * Threshold tier implied by the scenario alone.
     */
    public Criticality getBaseline() {
        return baseline;
    }

    public boolean alwaysRequiresManualReview() {
        return this == LOGIC_HEAVY;
    }
}
