package com.company.decommissioning.service;

import com.company.decommissioning.config.DecommissioningProperties;
import com.company.decommissioning.domain.DatabaseDefinition;
import com.company.decommissioning.domain.MonitoredDatabase;
import com.company.decommissioning.domain.ThresholdPolicy;
import com.company.decommissioning.domain.enums.Criticality;
import com.company.decommissioning.domain.enums.ScenarioType;
import com.company.decommissioning.event.PolicyReloadedEvent;
import com.company.decommissioning.exception.PolicyConfigException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the set of monitored databases. Readers see one consistent snapshot; a reload
 * either replaces the snapshot entirely or leaves it untouched.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PolicyRegistry {

    private final DecommissioningProperties properties;
    private final ThresholdPolicyResolver policyResolver;
    private final ApplicationEventPublisher eventPublisher;

    private final AtomicReference<Map<String, MonitoredDatabase>> databases =
            new AtomicReference<>(Collections.emptyMap());
    private final Object reloadLock = new Object();

    @PostConstruct
    public void loadInitial() {
        ReloadSummary summary = reload(properties.getDatabases());
        log.info("Policy registry initialized with {} databases", summary.getTotal());
    }

    public Collection<MonitoredDatabase> listDatabases() {
        return databases.get().values();
    }

    public Optional<MonitoredDatabase> find(String databaseId) {
        return Optional.ofNullable(databases.get().get(databaseId));
    }

    public boolean contains(String databaseId) {
        return databases.get().containsKey(databaseId);
    }

    public ThresholdPolicy resolve(MonitoredDatabase database) {
        return policyResolver.resolve(database.getCriticality(), database.getScenario());
    }

    /**
     * Validates every definition before touching the live snapshot.
     *
     * @throws PolicyConfigException if any definition is invalid; nothing is applied
     */
    public ReloadSummary reload(List<DatabaseDefinition> definitions) {
        Map<String, MonitoredDatabase> next = parse(definitions);

        synchronized (reloadLock) {
            Map<String, MonitoredDatabase> previous = databases.getAndSet(next);

            Set<String> removed = new HashSet<>(previous.keySet());
            removed.removeAll(next.keySet());
            Set<String> added = new HashSet<>(next.keySet());
            added.removeAll(previous.keySet());

            log.info("Policy reload applied: {} databases ({} added, {} removed)",
                    next.size(), added.size(), removed.size());
            if (!removed.isEmpty()) {
                log.info("Databases removed from monitoring: {}", removed);
            }

            eventPublisher.publishEvent(new PolicyReloadedEvent(Set.copyOf(next.keySet()), Set.copyOf(removed)));
            return new ReloadSummary(next.size(), Set.copyOf(added), Set.copyOf(removed));
        }
    }

    private Map<String, MonitoredDatabase> parse(List<DatabaseDefinition> definitions) {
        if (definitions == null) {
            throw new PolicyConfigException("database list is required");
        }

        List<String> problems = new ArrayList<>();
        Map<String, MonitoredDatabase> parsed = new LinkedHashMap<>();

        for (int i = 0; i < definitions.size(); i++) {
            DatabaseDefinition definition = definitions.get(i);
            String label = "databases[" + i + "]";

            if (definition == null) {
                problems.add(label + ": entry is empty");
                continue;
            }
            if (isBlank(definition.getId())) {
                problems.add(label + ": id is required");
                continue;
            }

            String id = definition.getId().trim();
            label = label + " (" + id + ")";

            Criticality criticality = parseEnum(Criticality.class, definition.getCriticality(), label, "criticality", problems);
            ScenarioType scenario = parseEnum(ScenarioType.class, definition.getScenario(), label, "scenario", problems);

            if (isBlank(definition.getOwnerEmail())) {
                problems.add(label + ": owner-email is required");
            } else if (!definition.getOwnerEmail().contains("@")) {
                problems.add(label + ": owner-email '" + definition.getOwnerEmail() + "' is not an e-mail address");
            }

            if (parsed.containsKey(id)) {
                problems.add(label + ": duplicate id");
                continue;
            }

            if (criticality != null && scenario != null && !isBlank(definition.getOwnerEmail())) {
                parsed.put(id, MonitoredDatabase.builder()
                        .id(id)
                        .criticality(criticality)
                        .scenario(scenario)
                        .ownerEmail(definition.getOwnerEmail().trim())
                        .manualReview(Boolean.TRUE.equals(definition.getManualReview()))
                        .build());
            }
        }

        if (!problems.isEmpty()) {
            throw new PolicyConfigException(problems);
        }
        return Collections.unmodifiableMap(parsed);
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String raw, String label,
                                                   String field, List<String> problems) {
        if (isBlank(raw)) {
            problems.add(label + ": " + field + " is required");
            return null;
        }
        try {
            return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            problems.add(label + ": unknown " + field + " '" + raw + "'");
            return null;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Value
    public static class ReloadSummary {
        int total;
        Set<String> added;
        Set<String> removed;
    }
}
