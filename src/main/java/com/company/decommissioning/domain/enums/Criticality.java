package com.company.decommissioning.domain.enums;

public enum Criticality {
    LOW(1),
    MEDIUM(2),
    CRITICAL(3);

    private final int level;

    Criticality(int level) {
        this.level = level;
    }

    public boolean isHigherThan(Criticality other) {
        return this.level > other.level;
    }

    /**
     * The stricter of two criticalities (the one with the shorter inactivity windows).
     */
    public static Criticality stricter(Criticality a, Criticality b) {
        return a.isHigherThan(b) ? a : b;
    }
}
