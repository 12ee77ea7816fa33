package com.company.decommissioning.controller;

import com.company.decommissioning.dto.request.ReloadPolicyRequest;
import com.company.decommissioning.dto.response.DatabaseStatusResponse;
import com.company.decommissioning.dto.response.ReloadResponse;
import com.company.decommissioning.service.PolicyRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/policies")
@Tag(name = "Policies", description = "Monitored database definitions and threshold policies")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class PolicyController {

    private final PolicyRegistry policyRegistry;
    private final MeterRegistry meterRegistry;

    @GetMapping
    @Operation(summary = "List the active classification and thresholds of every database")
    @PreAuthorize("hasAnyRole('OPERATOR', 'ADMIN')")
    public ResponseEntity<List<DatabaseStatusResponse>> listPolicies() {
        List<DatabaseStatusResponse> response = policyRegistry.listDatabases().stream()
                .map(db -> DatabaseStatusResponse.from(db, policyRegistry.resolve(db), null))
                .sorted(Comparator.comparing(DatabaseStatusResponse::getDatabaseId))
                .collect(Collectors.toList());
        return ResponseEntity.ok(response);
    }

    @PostMapping("/reload")
    @Operation(
            summary = "Replace the monitored database set",
            description = "All-or-nothing: an invalid entry rejects the whole reload and the current set stays active"
    )
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ReloadResponse> reload(@Valid @RequestBody ReloadPolicyRequest request) {
        log.info("Policy reload requested with {} databases", request.getDatabases().size());

        PolicyRegistry.ReloadSummary summary = policyRegistry.reload(request.getDatabases());

        meterRegistry.counter("decommissioning.policy.reloads").increment();

        return ResponseEntity.ok(ReloadResponse.builder()
                .totalDatabases(summary.getTotal())
                .added(summary.getAdded())
                .removed(summary.getRemoved())
                .reloadedAt(Instant.now())
                .build());
    }
}
