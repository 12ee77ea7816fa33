package com.company.decommissioning.service;

import com.company.decommissioning.domain.DeliveryFailure;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Keeps the most recent deliveries that exhausted their retries.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DeliveryFailureRecorder {

    static final int CAPACITY = 500;

    private final MeterRegistry meterRegistry;
    private final Deque<DeliveryFailure> failures = new ArrayDeque<>();

    public void record(DeliveryFailure failure) {
        log.error("Delivery failed for {} via {} after {} attempts (transition {}): {}",
                failure.getDatabaseId(), failure.getChannel(), failure.getAttempts(),
                failure.getTransitionKey(), failure.getLastError());

        meterRegistry.counter("decommissioning.delivery.failures",
                "channel", failure.getChannel().name(),
                "database", failure.getDatabaseId()
        ).increment();

        synchronized (failures) {
            failures.addFirst(failure);
            while (failures.size() > CAPACITY) {
                failures.removeLast();
            }
        }
    }

    public List<DeliveryFailure> recent() {
        synchronized (failures) {
            return new ArrayList<>(failures);
        }
    }
}
