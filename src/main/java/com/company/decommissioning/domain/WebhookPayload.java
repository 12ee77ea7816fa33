package com.company.decommissioning.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Body of the decommissioning workflow webhook. Field names are a fixed contract with the
 * automation endpoint.
 */
@Value
@Builder
public class WebhookPayload {
    @JsonProperty("database_name")
    String databaseName;

    @JsonProperty("scenario_type")
    String scenarioType;

    @JsonProperty("criticality")
    String criticality;

    @JsonProperty("owner_email")
    String ownerEmail;

    @JsonProperty("alert_timestamp")
    Instant alertTimestamp;

    @JsonProperty("metric_value")
    long metricValue;

    @JsonProperty("requires_manual_review")
    boolean requiresManualReview;
}
