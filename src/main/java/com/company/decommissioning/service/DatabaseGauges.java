package com.company.decommissioning.service;

import com.company.decommissioning.domain.AlertState;
import com.company.decommissioning.domain.MonitoredDatabase;
import com.company.decommissioning.event.PolicyReloadedEvent;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.MultiGauge;
import io.micrometer.core.instrument.Tags;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Per-database dashboard gauges: idle seconds and alert level (0 OK, 1 WARNING,
 * 2 CRITICAL), tagged by database, scenario and criticality. Rows follow the registry.
 */
@Component
@Slf4j
public class DatabaseGauges {

    private final PolicyRegistry policyRegistry;
    private final AlertStateStore stateStore;
    private final MultiGauge idleSeconds;
    private final MultiGauge status;

    // rows hold the value suppliers; kept here so they stay reachable
    private volatile List<MultiGauge.Row<?>> idleRows = List.of();
    private volatile List<MultiGauge.Row<?>> statusRows = List.of();

    public DatabaseGauges(PolicyRegistry policyRegistry, AlertStateStore stateStore, MeterRegistry meterRegistry) {
        this.policyRegistry = policyRegistry;
        this.stateStore = stateStore;
        this.idleSeconds = MultiGauge.builder("decommissioning.database.idle.seconds")
                .description("Seconds since the database last showed activity")
                .baseUnit("seconds")
                .register(meterRegistry);
        this.status = MultiGauge.builder("decommissioning.database.status")
                .description("Alert level per database: 0 OK, 1 WARNING, 2 CRITICAL")
                .register(meterRegistry);
    }

    @PostConstruct
    public void refresh() {
        List<MonitoredDatabase> databases = List.copyOf(policyRegistry.listDatabases());

        idleRows = databases.stream()
                .<MultiGauge.Row<?>>map(db -> MultiGauge.Row.of(tagsFor(db), () -> idleOf(db.getId())))
                .collect(Collectors.toList());
        statusRows = databases.stream()
                .<MultiGauge.Row<?>>map(db -> MultiGauge.Row.of(tagsFor(db), () -> statusOf(db.getId())))
                .collect(Collectors.toList());

        idleSeconds.register(idleRows, true);
        status.register(statusRows, true);

        log.debug("Dashboard gauges refreshed for {} databases", databases.size());
    }

    @EventListener
    public void onPolicyReloaded(PolicyReloadedEvent event) {
        refresh();
    }

    private Number idleOf(String databaseId) {
        return stateStore.find(databaseId)
                .map(AlertState::getIdleSeconds)
                .map(Long::doubleValue)
                .orElse(Double.NaN);
    }

    private Number statusOf(String databaseId) {
        return stateStore.find(databaseId)
                .map(state -> (double) state.getStatus().getGaugeValue())
                .orElse(Double.NaN);
    }

    private static Tags tagsFor(MonitoredDatabase database) {
        return Tags.of(
                "database", database.getId(),
                "scenario", database.getScenario().name(),
                "criticality", database.getCriticality().name());
    }
}
