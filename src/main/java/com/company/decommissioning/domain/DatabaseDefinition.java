package com.company.decommissioning.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw, unvalidated policy entry as it arrives from configuration or a reload request.
 * Enum fields stay strings here so bad values surface as policy errors instead of
 * binding failures.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DatabaseDefinition {
    private String id;
    private String criticality;
    private String scenario;
    private String ownerEmail;
    private Boolean manualReview;
}
