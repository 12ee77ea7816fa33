package com.company.decommissioning.domain;

import com.company.decommissioning.domain.enums.Criticality;
import lombok.Builder;
import lombok.Value;

/**
 * Inactivity windows (seconds) for one database. Recovery bounds sit strictly below
 * their trigger bounds so an idle duration hovering at a boundary does not flap.
 */
@Value
@Builder
public class ThresholdPolicy {
    Criticality tier;
    long criticalSeconds;
    long warningSeconds;
    long criticalRecoverySeconds;
    long warningRecoverySeconds;
}
