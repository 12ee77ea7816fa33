package com.company.decommissioning.controller;

import com.company.decommissioning.domain.DeliveryFailure;
import com.company.decommissioning.service.DeliveryFailureRecorder;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/deliveries")
@Tag(name = "Deliveries", description = "Notification deliveries that exhausted their retries")
@RequiredArgsConstructor
@Validated
@SecurityRequirement(name = "bearer-jwt")
public class DeliveryController {

    private final DeliveryFailureRecorder failureRecorder;

    @GetMapping("/failures")
    @Operation(summary = "Most recent failed deliveries, newest first")
    @PreAuthorize("hasAnyRole('OPERATOR', 'ADMIN')")
    public ResponseEntity<List<DeliveryFailure>> failures(
            @RequestParam(defaultValue = "50") @Min(1) @Max(500) int limit) {
        return ResponseEntity.ok(failureRecorder.recent().stream()
                .limit(limit)
                .collect(Collectors.toList()));
    }
}
