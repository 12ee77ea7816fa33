package com.company.decommissioning.domain.enums;

public enum AlertLevel {
    OK(0),
    WARNING(1),
    CRITICAL(2);

    private final int gaugeValue;

    AlertLevel(int gaugeValue) {
        this.gaugeValue = gaugeValue;
    }

    /**
     * Numeric value exported on the status gauge.
     */
    public int getGaugeValue() {
        return gaugeValue;
    }

    /**
     * Escalation may skip a level, recovery moves down one level at a time.
     */
    public boolean canTransitionTo(AlertLevel target) {
        return target.gaugeValue >= this.gaugeValue - 1;
    }
}
