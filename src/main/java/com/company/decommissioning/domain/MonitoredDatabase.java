package com.company.decommissioning.domain;

import com.company.decommissioning.domain.enums.Criticality;
import com.company.decommissioning.domain.enums.ScenarioType;
import lombok.Builder;
import lombok.Value;

/**
 * A database under inactivity monitoring. Immutable; a policy reload replaces the whole set.
 */
@Value
@Builder
public class MonitoredDatabase {
    String id;
    String ownerEmail;
    Criticality criticality;
    ScenarioType scenario;

    /** Explicit opt-in to manual review for databases that would not otherwise need it. */
    boolean manualReview;

    /**
     * LOGIC_HEAVY databases and CRITICAL systems are never auto-processed.
     */
    public boolean requiresManualReview() {
        return scenario.alwaysRequiresManualReview()
                || criticality == Criticality.CRITICAL
                || manualReview;
    }

    public boolean isAutoReviewEligible() {
        return scenario == ScenarioType.CONFIG_ONLY && !requiresManualReview();
    }

    /** Team handle derived from the owner address, e.g. {@code development-team}. */
    public String getOwnerHandle() {
        int at = ownerEmail.indexOf('@');
        return at > 0 ? ownerEmail.substring(0, at) : ownerEmail;
    }
}
