package com.company.decommissioning.service;

import com.company.decommissioning.config.DecommissioningProperties;
import com.company.decommissioning.domain.ActivitySnapshot;
import com.company.decommissioning.domain.NotificationEvent;
import com.company.decommissioning.domain.enums.AlertLevel;
import com.company.decommissioning.domain.enums.Criticality;
import com.company.decommissioning.domain.enums.ScenarioType;
import com.company.decommissioning.event.AlertTransitionEvent;
import com.company.decommissioning.event.PolicyReloadedEvent;
import com.company.decommissioning.exception.MetricFetchException;
import com.company.decommissioning.source.ActivityMetricSource;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;

import static com.company.decommissioning.TestDatabases.PAGILA;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("DatabaseEvaluationService Unit Tests")
class DatabaseEvaluationServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-10T12:00:00Z");

    @Mock
    private PolicyRegistry policyRegistry;

    @Mock
    private ActivityMetricSource metricSource;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @Captor
    private ArgumentCaptor<Object> eventCaptor;

    private DecommissioningProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private AlertStateStore stateStore;
    private Clock clock;

    @BeforeEach
    void setUp() {
        properties = new DecommissioningProperties();
        properties.getMetricSource().setTimeout(Duration.ofMillis(100));
        meterRegistry = new SimpleMeterRegistry();
        stateStore = new AlertStateStore();
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
    }

    private DatabaseEvaluationService service(Executor fetchExecutor) {
        return new DatabaseEvaluationService(
                policyRegistry,
                stateStore,
                new ThresholdEvaluator(properties, clock),
                new AlertStateMachine(stateStore, meterRegistry),
                metricSource,
                eventPublisher,
                meterRegistry,
                fetchExecutor,
                TimeLimiter.of(properties.getMetricSource().getTimeout()),
                clock,
                properties);
    }

    private void registerPagila() {
        when(policyRegistry.contains("pagila")).thenReturn(true);
        when(policyRegistry.resolve(PAGILA)).thenReturn(
                new ThresholdPolicyResolver(properties).resolve(Criticality.MEDIUM, ScenarioType.MIXED));
    }

    @Test
    @DisplayName("Should publish a transition event when a database crosses its warning window")
    void shouldPublishTransition() {
        registerPagila();
        when(metricSource.fetchActivity(eq("pagila"), any(Duration.class)))
                .thenReturn(ActivitySnapshot.of(NOW.minus(Duration.ofDays(2)), 6));

        Optional<NotificationEvent> event = service(Runnable::run).evaluate(PAGILA);

        assertThat(event).isPresent();
        assertThat(event.get().getToStatus()).isEqualTo(AlertLevel.WARNING);

        verify(eventPublisher).publishEvent(eventCaptor.capture());
        AlertTransitionEvent published = (AlertTransitionEvent) eventCaptor.getValue();
        assertThat(published.getNotification()).isEqualTo(event.get());
        assertThat(stateStore.find("pagila").orElseThrow().getStatus()).isEqualTo(AlertLevel.WARNING);
    }

    @Test
    @DisplayName("Should not publish anything when the status is reconfirmed")
    void shouldStayQuietWhenActive() {
        registerPagila();
        when(metricSource.fetchActivity(eq("pagila"), any(Duration.class)))
                .thenReturn(ActivitySnapshot.of(NOW.minus(Duration.ofMinutes(5)), 6));

        assertThat(service(Runnable::run).evaluate(PAGILA)).isEmpty();

        verify(eventPublisher, never()).publishEvent(any(Object.class));
        assertThat(stateStore.find("pagila").orElseThrow().getIdleSeconds()).isEqualTo(300);
    }

    @Test
    @DisplayName("Should skip databases that are no longer registered")
    void shouldSkipUnregistered() {
        when(policyRegistry.contains("pagila")).thenReturn(false);

        assertThat(service(Runnable::run).evaluate(PAGILA)).isEmpty();

        verify(metricSource, never()).fetchActivity(anyString(), any(Duration.class));
        assertThat(stateStore.find("pagila")).isEmpty();
    }

    @Test
    @DisplayName("A database dropped by a reload before its first evaluation is not tracked again")
    void shouldNotRecreateStateAfterReloadRemoval() {
        when(policyRegistry.contains("pagila")).thenReturn(false);
        stateStore.onPolicyReloaded(new PolicyReloadedEvent(Set.of(), Set.of("pagila")));

        assertThat(service(Runnable::run).evaluate(PAGILA)).isEmpty();

        verify(eventPublisher, never()).publishEvent(any(Object.class));
        assertThat(stateStore.find("pagila")).isEmpty();
        assertThat(stateStore.size()).isZero();
    }

    @Test
    @DisplayName("A reload that removes the database mid-evaluation discards the result")
    void shouldDiscardResultWhenRemovedDuringEvaluation() {
        registerPagila();
        when(metricSource.fetchActivity(eq("pagila"), any(Duration.class))).thenAnswer(invocation -> {
            stateStore.onPolicyReloaded(new PolicyReloadedEvent(Set.of(), Set.of("pagila")));
            return ActivitySnapshot.of(NOW.minus(Duration.ofDays(2)), 6);
        });

        assertThat(service(Runnable::run).evaluate(PAGILA)).isEmpty();

        verify(eventPublisher, never()).publishEvent(any(Object.class));
        assertThat(stateStore.find("pagila")).isEmpty();
    }

    @Test
    @DisplayName("Metric source errors degrade to no data")
    void fetchErrorIsNoData() {
        when(metricSource.fetchActivity(eq("pagila"), any(Duration.class)))
                .thenThrow(new MetricFetchException("pagila", new IllegalStateException("redis down")));

        ActivitySnapshot snapshot = service(Runnable::run).fetchActivity("pagila");

        assertThat(snapshot.isNoData()).isTrue();
        assertThat(meterRegistry.counter("decommissioning.metric.fetch.failures",
                "reason", "MetricFetchException").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("A fetch that never completes times out as no data")
    void fetchTimeoutIsNoData() {
        Executor neverRuns = command -> { };

        ActivitySnapshot snapshot = service(neverRuns).fetchActivity("pagila");

        assertThat(snapshot.isNoData()).isTrue();
        assertThat(meterRegistry.counter("decommissioning.metric.fetch.failures",
                "reason", "timeout").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("A fetch failure alone does not raise an alert")
    void fetchFailureDoesNotAlert() {
        registerPagila();
        when(metricSource.fetchActivity(eq("pagila"), any(Duration.class)))
                .thenThrow(new MetricFetchException("pagila", new IllegalStateException("redis down")));

        assertThat(service(Runnable::run).evaluate(PAGILA)).isEmpty();

        assertThat(stateStore.find("pagila").orElseThrow().getStatus()).isEqualTo(AlertLevel.OK);
        assertThat(stateStore.find("pagila").orElseThrow().getNoDataSince()).isEqualTo(NOW);
    }
}
