package com.company.decommissioning.event;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Set;

@Getter
@AllArgsConstructor
public class PolicyReloadedEvent {
    private final Set<String> activeDatabaseIds;
    private final Set<String> removedDatabaseIds;
}
