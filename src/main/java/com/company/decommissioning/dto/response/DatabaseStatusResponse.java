package com.company.decommissioning.dto.response;

import com.company.decommissioning.domain.AlertState;
import com.company.decommissioning.domain.MonitoredDatabase;
import com.company.decommissioning.domain.ThresholdPolicy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DatabaseStatusResponse {
    private String databaseId;
    private String scenario;
    private String criticality;
    private String ownerEmail;
    private boolean requiresManualReview;
    private boolean autoReviewEligible;

    private String status;
    private Instant since;
    private Instant lastEvaluated;
    private Instant lastActiveAt;
    private Instant noDataSince;
    private Long idleSeconds;

    private long warningSeconds;
    private long criticalSeconds;
    private long warningRecoverySeconds;
    private long criticalRecoverySeconds;

    /**
     * @param state may be null for a database not evaluated yet
     */
    public static DatabaseStatusResponse from(MonitoredDatabase database, ThresholdPolicy policy, AlertState state) {
        DatabaseStatusResponseBuilder builder = DatabaseStatusResponse.builder()
                .databaseId(database.getId())
                .scenario(database.getScenario().name())
                .criticality(database.getCriticality().name())
                .ownerEmail(database.getOwnerEmail())
                .requiresManualReview(database.requiresManualReview())
                .autoReviewEligible(database.isAutoReviewEligible())
                .warningSeconds(policy.getWarningSeconds())
                .criticalSeconds(policy.getCriticalSeconds())
                .warningRecoverySeconds(policy.getWarningRecoverySeconds())
                .criticalRecoverySeconds(policy.getCriticalRecoverySeconds());

        if (state == null) {
            return builder.status("PENDING").build();
        }

        return builder
                .status(state.getStatus().name())
                .since(state.getSince())
                .lastEvaluated(state.getLastEvaluated())
                .lastActiveAt(state.getLastActiveAt())
                .noDataSince(state.getNoDataSince())
                .idleSeconds(state.getIdleSeconds())
                .build();
    }
}
