package com.company.decommissioning.service;

import com.company.decommissioning.domain.enums.AlertLevel;
import com.company.decommissioning.event.PolicyReloadedEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static com.company.decommissioning.TestDatabases.PAGILA;
import static com.company.decommissioning.TestDatabases.POSTGRES_AIR;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DatabaseGaugesTest {

    @Mock
    private PolicyRegistry policyRegistry;

    private SimpleMeterRegistry meterRegistry;
    private AlertStateStore stateStore;
    private DatabaseGauges gauges;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        stateStore = new AlertStateStore();
        gauges = new DatabaseGauges(policyRegistry, stateStore, meterRegistry);
    }

    @Test
    void exportsIdleSecondsAndStatusPerDatabase() {
        when(policyRegistry.listDatabases()).thenReturn(List.of(PAGILA));
        stateStore.track("pagila", Instant.EPOCH);
        stateStore.update("pagila", state -> {
            state.setStatus(AlertLevel.WARNING);
            state.setIdleSeconds(180_000L);
        });

        gauges.refresh();

        assertThat(meterRegistry.get("decommissioning.database.idle.seconds")
                .tags("database", "pagila", "scenario", "MIXED", "criticality", "MEDIUM")
                .gauge().value()).isEqualTo(180_000.0);
        assertThat(meterRegistry.get("decommissioning.database.status")
                .tag("database", "pagila")
                .gauge().value()).isEqualTo(1.0);
    }

    @Test
    void gaugesReadLiveState() {
        when(policyRegistry.listDatabases()).thenReturn(List.of(POSTGRES_AIR));
        stateStore.track("postgres_air", Instant.EPOCH);
        gauges.refresh();

        stateStore.update("postgres_air", state -> state.setStatus(AlertLevel.CRITICAL));

        assertThat(meterRegistry.get("decommissioning.database.status")
                .tag("database", "postgres_air")
                .gauge().value()).isEqualTo(2.0);
    }

    @Test
    void reloadDropsRowsOfRemovedDatabases() {
        when(policyRegistry.listDatabases())
                .thenReturn(List.of(PAGILA, POSTGRES_AIR))
                .thenReturn(List.of(PAGILA));
        gauges.refresh();

        gauges.onPolicyReloaded(new PolicyReloadedEvent(Set.of("pagila"), Set.of("postgres_air")));

        assertThat(meterRegistry.find("decommissioning.database.status")
                .tag("database", "postgres_air")
                .gauge()).isNull();
        assertThat(meterRegistry.find("decommissioning.database.status")
                .tag("database", "pagila")
                .gauge()).isNotNull();
    }
}
