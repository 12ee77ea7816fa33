package com.company.decommissioning.controller;

import com.company.decommissioning.service.AlertStateStore;
import com.company.decommissioning.service.PolicyRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Health check endpoints")
@RequiredArgsConstructor
public class HealthController {

    private final PolicyRegistry policyRegistry;
    private final AlertStateStore stateStore;

    @GetMapping
    @Operation(summary = "Health check")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now());
        response.put("service", "decommissioning-monitor");
        response.put("version", "1.0.0");
        response.put("registeredDatabases", policyRegistry.listDatabases().size());
        response.put("trackedDatabases", stateStore.size());

        return ResponseEntity.ok(response);
    }
}
