package com.company.decommissioning.service;

import com.company.decommissioning.config.DecommissioningProperties;
import com.company.decommissioning.domain.ActivitySnapshot;
import com.company.decommissioning.domain.AlertState;
import com.company.decommissioning.domain.MonitoredDatabase;
import com.company.decommissioning.domain.NotificationEvent;
import com.company.decommissioning.domain.ThresholdPolicy;
import com.company.decommissioning.event.AlertTransitionEvent;
import com.company.decommissioning.source.ActivityMetricSource;
import com.company.decommissioning.util.EvaluationResult;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;

/**
 * One evaluation cycle for one database: fetch, classify, apply, notify.
 */
@Service
@Slf4j
public class DatabaseEvaluationService {

    private static final String MDC_DATABASE_KEY = "database";

    private final PolicyRegistry policyRegistry;
    private final AlertStateStore stateStore;
    private final ThresholdEvaluator evaluator;
    private final AlertStateMachine stateMachine;
    private final ActivityMetricSource metricSource;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Executor metricFetchExecutor;
    private final TimeLimiter fetchTimeLimiter;
    private final Clock clock;
    private final Duration evaluationWindow;

    public DatabaseEvaluationService(PolicyRegistry policyRegistry,
                                     AlertStateStore stateStore,
                                     ThresholdEvaluator evaluator,
                                     AlertStateMachine stateMachine,
                                     ActivityMetricSource metricSource,
                                     ApplicationEventPublisher eventPublisher,
                                     MeterRegistry meterRegistry,
                                     @Qualifier("metricFetchExecutor") Executor metricFetchExecutor,
                                     TimeLimiter metricFetchTimeLimiter,
                                     Clock clock,
                                     DecommissioningProperties properties) {
        this.policyRegistry = policyRegistry;
        this.stateStore = stateStore;
        this.evaluator = evaluator;
        this.stateMachine = stateMachine;
        this.metricSource = metricSource;
        this.eventPublisher = eventPublisher;
        this.meterRegistry = meterRegistry;
        this.metricFetchExecutor = metricFetchExecutor;
        this.fetchTimeLimiter = metricFetchTimeLimiter;
        this.clock = clock;
        this.evaluationWindow = properties.getEvaluation().getWindow();
    }

    public Optional<NotificationEvent> evaluate(MonitoredDatabase database) {
        MDC.put(MDC_DATABASE_KEY, database.getId());
        try {
            if (!stateStore.track(database.getId(), clock.instant(), policyRegistry::contains)) {
                log.debug("Skipping {}: no longer registered", database.getId());
                return Optional.empty();
            }

            ThresholdPolicy policy = policyRegistry.resolve(database);

            ActivitySnapshot activity = fetchActivity(database.getId());
            Instant now = clock.instant();

            Optional<AlertState> state = stateStore.find(database.getId());
            if (state.isEmpty()) {
                return Optional.empty();
            }

            EvaluationResult evaluation = evaluator.evaluate(policy, state.get(), activity, now);
            Optional<NotificationEvent> event = stateMachine.apply(database, policy, evaluation, activity, now);

            // listeners run synchronously, keeping notifications ordered per database
            event.ifPresent(e -> eventPublisher.publishEvent(new AlertTransitionEvent(e)));
            return event;

        } finally {
            MDC.remove(MDC_DATABASE_KEY);
        }
    }

    /**
     * Fetch under the metric fetch time limiter. Timeouts and source errors degrade to no data.
     */
    ActivitySnapshot fetchActivity(String databaseId) {
        try {
            return fetchTimeLimiter.executeFutureSupplier(() -> CompletableFuture.supplyAsync(
                    () -> metricSource.fetchActivity(databaseId, evaluationWindow), metricFetchExecutor));

        } catch (TimeoutException e) {
            log.warn("Metric fetch for {} timed out after {}ms, treating as no data",
                    databaseId, fetchTimeLimiter.getTimeLimiterConfig().getTimeoutDuration().toMillis());
            recordFetchFailure("timeout");
            return ActivitySnapshot.noData();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFetchFailure("interrupted");
            return ActivitySnapshot.noData();

        } catch (Exception e) {
            log.warn("Metric fetch for {} failed, treating as no data: {}", databaseId, e.getMessage());
            recordFetchFailure(e.getClass().getSimpleName());
            return ActivitySnapshot.noData();
        }
    }

    private void recordFetchFailure(String reason) {
        meterRegistry.counter("decommissioning.metric.fetch.failures", "reason", reason).increment();
    }
}
