package com.company.decommissioning.scheduled;

import com.company.decommissioning.domain.MonitoredDatabase;
import com.company.decommissioning.service.DatabaseEvaluationService;
import com.company.decommissioning.service.PolicyRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * INACTIVITY EVALUATION (every 15 minutes by default)
 * Fans each registered database out to the evaluation pool. A database whose previous
 * evaluation is still running is skipped for this cycle.
 */
@Component
@Slf4j
@ConditionalOnProperty(
        value = "decommissioning.evaluation.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class InactivityEvaluationJob {

    private final PolicyRegistry policyRegistry;
    private final DatabaseEvaluationService evaluationService;
    private final TaskExecutor evaluationExecutor;
    private final MeterRegistry meterRegistry;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public InactivityEvaluationJob(PolicyRegistry policyRegistry,
                                   DatabaseEvaluationService evaluationService,
                                   @Qualifier("evaluationExecutor") TaskExecutor evaluationExecutor,
                                   MeterRegistry meterRegistry) {
        this.policyRegistry = policyRegistry;
        this.evaluationService = evaluationService;
        this.evaluationExecutor = evaluationExecutor;
        this.meterRegistry = meterRegistry;
    }

    @Scheduled(
            fixedDelayString = "${decommissioning.evaluation.interval-ms:900000}",
            initialDelayString = "${decommissioning.evaluation.initial-delay-ms:30000}"
    )
    public void runCycle() {
        Instant startTime = Instant.now();
        Collection<MonitoredDatabase> databases = policyRegistry.listDatabases();

        if (databases.isEmpty()) {
            log.debug("No databases registered for inactivity monitoring");
            return;
        }

        int submitted = 0;
        int skipped = 0;

        for (MonitoredDatabase database : databases) {
            if (submit(database)) {
                submitted++;
            } else {
                skipped++;
            }
        }

        Duration elapsed = Duration.between(startTime, Instant.now());
        log.info("Inactivity cycle: {} evaluations submitted, {} skipped in {}ms",
                submitted, skipped, elapsed.toMillis());

        meterRegistry.counter("decommissioning.evaluations.submitted").increment(submitted);
        meterRegistry.timer("decommissioning.evaluation.cycle.duration")
                .record(elapsed.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * @return false when the database is still being evaluated or the pool is full
     */
    boolean submit(MonitoredDatabase database) {
        String databaseId = database.getId();

        if (!inFlight.add(databaseId)) {
            log.warn("Evaluation for {} still in flight, skipping this cycle", databaseId);
            meterRegistry.counter("decommissioning.evaluations.skipped", "reason", "in_flight").increment();
            return false;
        }

        try {
            evaluationExecutor.execute(() -> {
                try {
                    evaluationService.evaluate(database);
                } catch (Exception e) {
                    log.error("Evaluation failed for database {}", databaseId, e);
                    meterRegistry.counter("decommissioning.evaluations.failures").increment();
                } finally {
                    inFlight.remove(databaseId);
                }
            });
            return true;

        } catch (TaskRejectedException e) {
            inFlight.remove(databaseId);
            log.warn("Evaluation pool saturated, {} deferred to next cycle", databaseId);
            meterRegistry.counter("decommissioning.evaluations.skipped", "reason", "rejected").increment();
            return false;
        }
    }

    boolean isInFlight(String databaseId) {
        return inFlight.contains(databaseId);
    }
}
