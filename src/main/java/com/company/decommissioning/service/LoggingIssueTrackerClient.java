package com.company.decommissioning.service;

import com.company.decommissioning.domain.IssuePayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Fallback when no tracker integration is configured: the ticket goes to the log.
 */
@Component
@Slf4j
@ConditionalOnProperty(
        value = "decommissioning.issues.github.enabled",
        havingValue = "false",
        matchIfMissing = true
)
public class LoggingIssueTrackerClient implements IssueTrackerClient {

    @Override
    public String createIssue(IssuePayload issue) {
        log.warn("Manual review issue for {} (labels {}):\n{}\n{}",
                issue.getDatabaseId(), issue.getLabels(), issue.getTitle(), issue.getBody());
        return "log:" + issue.getTransitionKey();
    }
}
