package com.company.decommissioning.util;

import com.company.decommissioning.domain.enums.AlertLevel;
import lombok.Value;

import java.time.Instant;

/**
 * Outcome of classifying one sample: the proposed status, never applied by the evaluator itself.
 */
@Value
public class EvaluationResult {
    AlertLevel proposedStatus;
    long idleSeconds;
    /** Last activity the idle duration was measured from; null if idle since process start. */
    Instant lastActiveAt;
    boolean noDataExpired;
}
