package com.company.decommissioning.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReloadResponse {
    private int totalDatabases;
    private Set<String> added;
    private Set<String> removed;
    private Instant reloadedAt;
}
