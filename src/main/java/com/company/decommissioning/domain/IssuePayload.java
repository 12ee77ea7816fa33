package com.company.decommissioning.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class IssuePayload {
    String databaseId;
    String transitionKey;
    String title;
    String body;
    List<String> labels;
}
