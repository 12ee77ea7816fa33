package com.company.decommissioning.service;

import com.company.decommissioning.domain.AlertState;
import com.company.decommissioning.event.PolicyReloadedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Per-database alert state keyed by database id. Each entry is only mutated from that
 * database's own evaluation task; readers get copies.
 */
@Component
@Slf4j
public class AlertStateStore {

    private final ConcurrentMap<String, AlertState> states = new ConcurrentHashMap<>();

    /**
     * Starts tracking a database at OK if it is not tracked yet.
     */
    public void track(String databaseId, Instant now) {
        track(databaseId, now, id -> true);
    }

    /**
     * Starts tracking a database at OK if it is not tracked yet and {@code registered}
     * still accepts it. The check runs under the entry's lock, so a reload that drops
     * the database either prevents the entry or discards it afterwards.
     *
     * @return whether the database is tracked after the call
     */
    public boolean track(String databaseId, Instant now, Predicate<String> registered) {
        return states.computeIfAbsent(databaseId, id -> {
            if (!registered.test(id)) {
                return null;
            }
            log.info("Tracking new database {} (status OK)", id);
            return AlertState.initial(id, now);
        }) != null;
    }

    public Optional<AlertState> find(String databaseId) {
        AlertState state = states.get(databaseId);
        return state == null ? Optional.empty() : Optional.of(state.copy());
    }

    public Collection<AlertState> snapshot() {
        return states.values().stream()
                .map(AlertState::copy)
                .collect(Collectors.toList());
    }

    /**
     * Applies {@code mutation} atomically to a tracked database.
     *
     * @return false, without calling the mutation, when the database is no longer tracked
     */
    public boolean update(String databaseId, Consumer<AlertState> mutation) {
        return states.computeIfPresent(databaseId, (id, state) -> {
            mutation.accept(state);
            return state;
        }) != null;
    }

    public void discard(String databaseId) {
        if (states.remove(databaseId) != null) {
            log.info("Discarded alert state for database {}", databaseId);
        }
    }

    @EventListener
    public void onPolicyReloaded(PolicyReloadedEvent event) {
        event.getRemovedDatabaseIds().forEach(this::discard);
        states.keySet().retainAll(event.getActiveDatabaseIds());
    }

    public int size() {
        return states.size();
    }
}
