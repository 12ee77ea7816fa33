package com.company.decommissioning.service;

import com.company.decommissioning.config.DecommissioningProperties;
import com.company.decommissioning.domain.DeliveryFailure;
import com.company.decommissioning.domain.IssuePayload;
import com.company.decommissioning.domain.MonitoredDatabase;
import com.company.decommissioning.domain.NotificationEvent;
import com.company.decommissioning.domain.WebhookPayload;
import com.company.decommissioning.domain.enums.AlertLevel;
import com.company.decommissioning.domain.enums.DeliveryChannel;
import com.company.decommissioning.event.AlertTransitionEvent;
import com.company.decommissioning.exception.DeliveryException;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.function.Supplier;

/**
 * Turns alert transitions into outbound notifications: rendered messages, the workflow
 * webhook and, for databases that need manual review, an issue-tracker ticket.
 * Delivery failures are recorded and never feed back into alert state.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NotificationDispatcher {

    private final AlertMessageRenderer renderer;
    private final WebhookSender webhookSender;
    private final IssueTrackerClient issueTrackerClient;
    private final IssueLedger issueLedger;
    private final DeliveryFailureRecorder failureRecorder;
    private final Retry deliveryRetry;
    private final DecommissioningProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @EventListener
    public void onAlertTransition(AlertTransitionEvent event) {
        dispatch(event.getNotification());
    }

    public DispatchResult dispatch(NotificationEvent event) {
        String message = renderer.renderAlert(event);

        if (event.getToStatus() == AlertLevel.CRITICAL) {
            log.warn("Decommissioning alert for {}: {} -> {}\n{}",
                    event.getDatabaseId(), event.getFromStatus(), event.getToStatus(), message);
        } else {
            log.info("Decommissioning alert for {}: {} -> {}\n{}",
                    event.getDatabaseId(), event.getFromStatus(), event.getToStatus(), message);
        }

        String escalation = null;
        boolean manualDisposition = false;
        if (event.getToStatus() == AlertLevel.CRITICAL && event.isRequiresManualReview()) {
            escalation = renderer.renderEscalation(event);
            manualDisposition = true;
            log.warn("Escalation for {}:\n{}", event.getDatabaseId(), escalation);
        }

        boolean delivered = deliverWebhook(event);

        DispatchResult.IssueOutcome issueOutcome = DispatchResult.IssueOutcome.NOT_REQUIRED;
        String issueReference = null;
        if (event.isRequiresManualReview() && event.isEscalation()) {
            IssuePayload issue = renderer.renderIssue(event);
            try {
                if (!issueLedger.claim(issue.getTransitionKey())) {
                    log.debug("Issue for transition {} already claimed", issue.getTransitionKey());
                    meterRegistry.counter("decommissioning.issues.suppressed").increment();
                    issueOutcome = DispatchResult.IssueOutcome.DUPLICATE_SUPPRESSED;
                } else {
                    issueReference = submitIssue(event, issue);
                    issueOutcome = issueReference != null
                            ? DispatchResult.IssueOutcome.CREATED
                            : DispatchResult.IssueOutcome.FAILED;
                }
            } catch (DataAccessException e) {
                log.error("Issue ledger unavailable, no issue created for transition {}: {}",
                        issue.getTransitionKey(), e.getMessage());
                recordFailure(event, DeliveryChannel.ISSUE_TRACKER, 1, e);
                issueOutcome = DispatchResult.IssueOutcome.FAILED;
            }
        }

        return DispatchResult.builder()
                .message(message)
                .escalationMessage(escalation)
                .manualDispositionRequired(manualDisposition)
                .webhookDelivered(delivered)
                .issueOutcome(issueOutcome)
                .issueReference(issueReference)
                .build();
    }

    private boolean deliverWebhook(NotificationEvent event) {
        if (!properties.getWebhook().isEnabled()) {
            log.debug("Webhook disabled, skipping delivery for {}", event.getDatabaseId());
            return false;
        }

        WebhookPayload payload = toWebhookPayload(event);
        try {
            Retry.decorateRunnable(deliveryRetry, () -> webhookSender.send(payload)).run();
            meterRegistry.counter("decommissioning.webhook.delivered",
                    "status", event.getToStatus().name()).increment();
            return true;
        } catch (DeliveryException e) {
            recordFailure(event, DeliveryChannel.WEBHOOK, maxAttempts(), e);
            return false;
        }
    }

    private String submitIssue(NotificationEvent event, IssuePayload issue) {
        Supplier<String> create = Retry.decorateSupplier(deliveryRetry, () -> issueTrackerClient.createIssue(issue));
        String reference;
        try {
            reference = create.get();
        } catch (DeliveryException e) {
            releaseClaim(issue);
            recordFailure(event, DeliveryChannel.ISSUE_TRACKER, maxAttempts(), e);
            return null;
        }

        meterRegistry.counter("decommissioning.issues.created",
                "scenario", event.getDatabase().getScenario().name()).increment();
        try {
            issueLedger.markCreated(issue.getTransitionKey(), reference);
        } catch (DataAccessException e) {
            // the pending claim still blocks duplicates until its TTL runs out
            log.error("Issue {} created but not recorded for transition {}: {}",
                    reference, issue.getTransitionKey(), e.getMessage());
        }
        return reference;
    }

    private void releaseClaim(IssuePayload issue) {
        try {
            issueLedger.release(issue.getTransitionKey());
        } catch (DataAccessException e) {
            log.error("Could not release issue claim for transition {}: {}",
                    issue.getTransitionKey(), e.getMessage());
        }
    }

    private int maxAttempts() {
        return deliveryRetry.getRetryConfig().getMaxAttempts();
    }

    private void recordFailure(NotificationEvent event, DeliveryChannel channel, int attempts, Exception e) {
        failureRecorder.record(DeliveryFailure.builder()
                .databaseId(event.getDatabaseId())
                .channel(channel)
                .transitionKey(event.getTransitionKey())
                .attempts(attempts)
                .lastError(e.getMessage())
                .failedAt(clock.instant())
                .build());
    }

    static WebhookPayload toWebhookPayload(NotificationEvent event) {
        MonitoredDatabase database = event.getDatabase();
        return WebhookPayload.builder()
                .databaseName(database.getId())
                .scenarioType(database.getScenario().name())
                .criticality(database.getCriticality().name())
                .ownerEmail(database.getOwnerEmail())
                .alertTimestamp(event.getOccurredAt())
                .metricValue(event.getMetricValue())
                .requiresManualReview(event.isRequiresManualReview())
                .build();
    }
}
