package com.company.decommissioning.service;

import com.company.decommissioning.domain.ActivitySnapshot;
import com.company.decommissioning.domain.AlertState;
import com.company.decommissioning.domain.MonitoredDatabase;
import com.company.decommissioning.domain.NotificationEvent;
import com.company.decommissioning.domain.ThresholdPolicy;
import com.company.decommissioning.domain.enums.AlertLevel;
import com.company.decommissioning.util.EvaluationResult;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/**
 * Applies evaluation proposals to alert state. Emits a notification only when the status
 * actually changes; reconfirming the current status is a suppressed duplicate.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AlertStateMachine {

    private final AlertStateStore stateStore;
    private final MeterRegistry meterRegistry;

    public Optional<NotificationEvent> apply(MonitoredDatabase database, ThresholdPolicy policy,
                                             EvaluationResult evaluation, ActivitySnapshot activity,
                                             Instant now) {
        String databaseId = database.getId();

        NotificationEvent[] emitted = new NotificationEvent[1];
        boolean tracked = stateStore.update(databaseId, state ->
                emitted[0] = transition(database, policy, state, evaluation, activity, now));

        if (!tracked) {
            log.debug("Database {} left the registry during evaluation, result discarded", databaseId);
            meterRegistry.counter("decommissioning.evaluations.discarded").increment();
            return Optional.empty();
        }
        return Optional.ofNullable(emitted[0]);
    }

    private NotificationEvent transition(MonitoredDatabase database, ThresholdPolicy policy, AlertState state,
                                         EvaluationResult evaluation, ActivitySnapshot activity, Instant now) {
        state.setLastEvaluated(now);
        state.setIdleSeconds(evaluation.getIdleSeconds());
        if (evaluation.getLastActiveAt() != null) {
            state.setLastActiveAt(evaluation.getLastActiveAt());
        }
        if (activity.isNoData()) {
            if (state.getNoDataSince() == null) {
                state.setNoDataSince(now);
            }
        } else {
            state.setNoDataSince(null);
        }

        AlertLevel current = state.getStatus();
        AlertLevel proposed = evaluation.getProposedStatus();

        if (!current.canTransitionTo(proposed)) {
            log.warn("Illegal transition {} -> {} proposed for {}, holding at WARNING",
                    current, proposed, database.getId());
            proposed = AlertLevel.WARNING;
        }

        if (proposed == current) {
            log.debug("Duplicate suppressed for {}: status {} reconfirmed (idle {}s)",
                    database.getId(), current, evaluation.getIdleSeconds());
            meterRegistry.counter("decommissioning.transitions.suppressed",
                    "status", current.name()
            ).increment();
            return null;
        }

        state.setStatus(proposed);
        state.setSince(now);

        NotificationEvent event = NotificationEvent.builder()
                .databaseId(database.getId())
                .fromStatus(current)
                .toStatus(proposed)
                .metricValue(evaluation.getIdleSeconds())
                .occurredAt(now)
                .requiresManualReview(database.requiresManualReview())
                .database(database)
                .policy(policy)
                .build();

        meterRegistry.counter("decommissioning.transitions",
                "from", current.name(),
                "to", proposed.name(),
                "scenario", database.getScenario().name()
        ).increment();

        log.info("Alert transition for {}: {} -> {} (idle {}s, noDataExpired={})",
                database.getId(), current, proposed, evaluation.getIdleSeconds(), evaluation.isNoDataExpired());

        return event;
    }
}
