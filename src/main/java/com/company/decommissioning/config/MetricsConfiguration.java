package com.company.decommissioning.config;

import com.company.decommissioning.domain.AlertState;
import com.company.decommissioning.domain.enums.AlertLevel;
import com.company.decommissioning.service.AlertStateStore;
import com.company.decommissioning.service.PolicyRegistry;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Fleet-level gauges: how many databases sit in each alert level.
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final AlertStateStore stateStore;
    private final PolicyRegistry policyRegistry;

    @Bean
    public MeterBinder decommissioningMetrics() {
        return (reg) -> {
            for (AlertLevel level : AlertLevel.values()) {
                Gauge.builder("decommissioning.databases", stateStore, store -> countAt(store, level))
                        .description("Monitored databases currently at each alert level")
                        .tag("status", level.name())
                        .register(reg);
            }

            Gauge.builder("decommissioning.databases.registered", policyRegistry,
                            registry -> registry.listDatabases().size())
                    .description("Databases in the active policy registry")
                    .register(reg);

            log.info("Decommissioning metrics registered");
        };
    }

    private static double countAt(AlertStateStore store, AlertLevel level) {
        return store.snapshot().stream()
                .map(AlertState::getStatus)
                .filter(status -> status == level)
                .count();
    }
}
