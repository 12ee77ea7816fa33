package com.company.decommissioning.service;

import com.company.decommissioning.domain.AlertState;
import com.company.decommissioning.domain.enums.AlertLevel;
import com.company.decommissioning.event.PolicyReloadedEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class AlertStateStoreTest {

    private static final Instant NOW = Instant.parse("2024-03-10T12:00:00Z");

    private final AlertStateStore store = new AlertStateStore();

    @Test
    void newDatabasesStartAtOk() {
        store.track("chinook", NOW);

        AlertState state = store.find("chinook").orElseThrow();
        assertThat(state.getStatus()).isEqualTo(AlertLevel.OK);
        assertThat(state.getSince()).isEqualTo(NOW);
    }

    @Test
    void trackingTwiceKeepsExistingState() {
        store.track("chinook", NOW);
        store.update("chinook", state -> state.setStatus(AlertLevel.WARNING));

        store.track("chinook", NOW.plusSeconds(900));

        assertThat(store.find("chinook").orElseThrow().getStatus()).isEqualTo(AlertLevel.WARNING);
    }

    @Test
    void unregisteredDatabasesAreNotTracked() {
        assertThat(store.track("chinook", NOW, id -> false)).isFalse();
        assertThat(store.find("chinook")).isEmpty();
    }

    @Test
    void registrationCheckOnlyGuardsNewEntries() {
        store.track("chinook", NOW);

        assertThat(store.track("chinook", NOW, id -> false)).isTrue();
        assertThat(store.find("chinook")).isPresent();
    }

    @Test
    void readersGetCopies() {
        store.track("chinook", NOW);

        store.find("chinook").orElseThrow().setStatus(AlertLevel.CRITICAL);

        assertThat(store.find("chinook").orElseThrow().getStatus()).isEqualTo(AlertLevel.OK);
    }

    @Test
    void updateOfUntrackedDatabaseIsRejected() {
        assertThat(store.update("ghost", state -> state.setStatus(AlertLevel.CRITICAL))).isFalse();
        assertThat(store.find("ghost")).isEmpty();
    }

    @Test
    void reloadDiscardsStateOfRemovedDatabases() {
        store.track("chinook", NOW);
        store.track("netflix", NOW);
        store.track("lego", NOW);

        store.onPolicyReloaded(new PolicyReloadedEvent(Set.of("chinook", "lego"), Set.of("netflix")));

        assertThat(store.find("netflix")).isEmpty();
        assertThat(store.size()).isEqualTo(2);
    }
}
