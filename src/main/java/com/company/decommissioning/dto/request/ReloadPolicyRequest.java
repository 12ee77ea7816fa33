package com.company.decommissioning.dto.request;

import com.company.decommissioning.domain.DatabaseDefinition;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Full replacement set of monitored databases.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReloadPolicyRequest {

    @NotNull(message = "Database list is required")
    private List<DatabaseDefinition> databases;
}
