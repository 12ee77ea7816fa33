package com.company.decommissioning.domain;

import com.company.decommissioning.domain.enums.AlertLevel;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A single alert status change, handed to the dispatcher exactly once.
 */
@Value
@Builder
public class NotificationEvent {
    String databaseId;
    AlertLevel fromStatus;
    AlertLevel toStatus;
    long metricValue;
    Instant occurredAt;
    boolean requiresManualReview;

    MonitoredDatabase database;
    ThresholdPolicy policy;

    /**
     * Identifies the (database, transition) pair; used to keep issue creation idempotent.
     */
    public String getTransitionKey() {
        return databaseId + ":" + fromStatus + "->" + toStatus + ":" + occurredAt.toEpochMilli();
    }

    public boolean isEscalation() {
        return toStatus.getGaugeValue() > fromStatus.getGaugeValue();
    }
}
