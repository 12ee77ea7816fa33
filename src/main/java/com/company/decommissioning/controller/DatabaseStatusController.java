package com.company.decommissioning.controller;

import com.company.decommissioning.domain.MonitoredDatabase;
import com.company.decommissioning.dto.response.DatabaseStatusResponse;
import com.company.decommissioning.exception.DatabaseNotFoundException;
import com.company.decommissioning.service.AlertStateStore;
import com.company.decommissioning.service.PolicyRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/databases")
@Tag(name = "Database Status", description = "Current decommissioning alert status per database")
@RequiredArgsConstructor
@SecurityRequirement(name = "bearer-jwt")
public class DatabaseStatusController {

    private final PolicyRegistry policyRegistry;
    private final AlertStateStore stateStore;

    @GetMapping
    @Operation(
            summary = "List monitored databases with their alert status",
            description = "Optionally filtered by status (OK, WARNING, CRITICAL). PENDING matches "
                    + "databases that have not been evaluated yet."
    )
    @PreAuthorize("hasAnyRole('OPERATOR', 'ADMIN')")
    public ResponseEntity<List<DatabaseStatusResponse>> listDatabases(
            @Parameter(description = "Only return databases at this status")
            @RequestParam(required = false) String status) {

        List<DatabaseStatusResponse> response = policyRegistry.listDatabases().stream()
                .map(this::toResponse)
                .filter(r -> status == null || r.getStatus().equalsIgnoreCase(status))
                .sorted(Comparator.comparing(DatabaseStatusResponse::getDatabaseId))
                .collect(Collectors.toList());

        return ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(30, TimeUnit.SECONDS).cachePrivate())
                .body(response);
    }

    @GetMapping("/{databaseId}")
    @Operation(summary = "Get alert status and thresholds for one database")
    @PreAuthorize("hasAnyRole('OPERATOR', 'ADMIN')")
    public ResponseEntity<DatabaseStatusResponse> getDatabase(@PathVariable String databaseId) {
        MonitoredDatabase database = policyRegistry.find(databaseId)
                .orElseThrow(() -> new DatabaseNotFoundException(databaseId));

        return ResponseEntity.ok(toResponse(database));
    }

    private DatabaseStatusResponse toResponse(MonitoredDatabase database) {
        return DatabaseStatusResponse.from(
                database,
                policyRegistry.resolve(database),
                stateStore.find(database.getId()).orElse(null));
    }
}
