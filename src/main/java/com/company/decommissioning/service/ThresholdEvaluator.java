package com.company.decommissioning.service;

import com.company.decommissioning.config.DecommissioningProperties;
import com.company.decommissioning.domain.ActivitySnapshot;
import com.company.decommissioning.domain.AlertState;
import com.company.decommissioning.domain.ThresholdPolicy;
import com.company.decommissioning.domain.enums.AlertLevel;
import com.company.decommissioning.util.EvaluationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Classifies idle duration against a policy with hysteresis. Pure: reads the current
 * state, returns a proposal.
 */
@Component
@Slf4j
public class ThresholdEvaluator {

    private final Duration noDataWindow;
    private final Instant processStart;

    public ThresholdEvaluator(DecommissioningProperties properties, Clock clock) {
        this.noDataWindow = properties.getNoDataWindow();
        this.processStart = clock.instant();
    }

    public EvaluationResult evaluate(ThresholdPolicy policy, AlertState state, ActivitySnapshot activity, Instant now) {
        Instant lastActiveAt = latest(activity.getLastActiveAt(), state.getLastActiveAt());
        Instant reference = lastActiveAt != null ? lastActiveAt : processStart;
        long idleSeconds = Math.max(0, Duration.between(reference, now).getSeconds());

        boolean noDataExpired = false;
        if (activity.isNoData()) {
            Instant silentSince = state.getNoDataSince() != null ? state.getNoDataSince() : now;
            noDataExpired = !Duration.between(silentSince, now).minus(noDataWindow).isNegative();
        }

        // silence past the window is read as maximal idleness
        long effectiveIdle = noDataExpired ? Long.MAX_VALUE : idleSeconds;
        AlertLevel proposed = classify(policy, state.getStatus(), effectiveIdle);

        log.debug("Evaluated {}: status={} idle={}s noData={} noDataExpired={} proposed={}",
                state.getDatabaseId(), state.getStatus(), idleSeconds, activity.isNoData(), noDataExpired, proposed);

        return new EvaluationResult(proposed, idleSeconds, lastActiveAt, noDataExpired);
    }

    /**
     * OK escalates on the trigger bounds (CRITICAL first). WARNING clears only at or
     * below its recovery bound. CRITICAL steps down to WARNING at or below its recovery
     * bound and never straight to OK.
     */
    public AlertLevel classify(ThresholdPolicy policy, AlertLevel current, long idleSeconds) {
        switch (current) {
            case OK:
                if (idleSeconds >= policy.getCriticalSeconds()) return AlertLevel.CRITICAL;
                if (idleSeconds >= policy.getWarningSeconds()) return AlertLevel.WARNING;
                return AlertLevel.OK;
            case WARNING:
                if (idleSeconds >= policy.getCriticalSeconds()) return AlertLevel.CRITICAL;
                if (idleSeconds <= policy.getWarningRecoverySeconds()) return AlertLevel.OK;
                return AlertLevel.WARNING;
            case CRITICAL:
                if (idleSeconds <= policy.getCriticalRecoverySeconds()) return AlertLevel.WARNING;
                return AlertLevel.CRITICAL;
            default:
                throw new IllegalStateException("Unknown alert level " + current);
        }
    }

    private static Instant latest(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }
}
