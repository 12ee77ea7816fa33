package com.company.decommissioning.service;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DispatchResult {

    public enum IssueOutcome {
        NOT_REQUIRED,
        CREATED,
        DUPLICATE_SUPPRESSED,
        FAILED
    }

    String message;
    String escalationMessage;
    boolean manualDispositionRequired;
    boolean webhookDelivered;
    IssueOutcome issueOutcome;
    String issueReference;
}
