package com.company.decommissioning.domain;

import com.company.decommissioning.domain.enums.AlertLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AlertState {
    private String databaseId;
    private AlertLevel status;
    private Instant since;
    private Instant lastEvaluated;
    private Instant noDataSince;
    private Instant lastActiveAt;
    private Long idleSeconds;

    public static AlertState initial(String databaseId, Instant now) {
        return AlertState.builder()
                .databaseId(databaseId)
                .status(AlertLevel.OK)
                .since(now)
                .build();
    }

    public AlertState copy() {
        return toBuilder().build();
    }
}
