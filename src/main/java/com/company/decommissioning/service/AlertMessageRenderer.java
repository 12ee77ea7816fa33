package com.company.decommissioning.service;

import com.company.decommissioning.domain.IssuePayload;
import com.company.decommissioning.domain.MonitoredDatabase;
import com.company.decommissioning.domain.NotificationEvent;
import com.company.decommissioning.domain.ThresholdPolicy;
import com.company.decommissioning.domain.enums.AlertLevel;
import com.company.decommissioning.domain.enums.Criticality;
import com.company.decommissioning.domain.enums.ScenarioType;
import com.company.decommissioning.util.TimeUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Renders operator-facing text for alert transitions: the alert message, the escalation
 * message and the issue-tracker ticket.
 */
@Component
public class AlertMessageRenderer {

    private final String teamContact;

    public AlertMessageRenderer(@Value("${decommissioning.notification.team-contact:database-team@company.com}")
                                String teamContact) {
        this.teamContact = teamContact;
    }

    public String renderAlert(NotificationEvent event) {
        MonitoredDatabase database = event.getDatabase();
        long threshold = crossedThreshold(event);
        StringBuilder message = new StringBuilder();

        if (event.isEscalation()) {
            message.append("**Database Decommissioning Candidate Detected**\n\n");
        } else {
            message.append("**Database Activity Recovered**\n\n");
        }

        message.append("Database: ").append(database.getId()).append('\n')
                .append("Scenario Type: ").append(database.getScenario()).append('\n')
                .append("Criticality: ").append(database.getCriticality()).append('\n')
                .append("Status: ").append(event.getFromStatus()).append(" -> ").append(event.getToStatus()).append("\n\n");

        message.append("**Alert Details:**\n")
                .append("- No active connections detected for ").append(event.getMetricValue())
                .append(" seconds (").append(TimeUtils.formatDuration(event.getMetricValue())).append(")\n")
                .append("- Threshold: ").append(threshold).append(" seconds (")
                .append(TimeUtils.formatDays(threshold)).append(" days)\n")
                .append("- Owner: ").append(database.getOwnerEmail()).append("\n\n");

        if (event.isEscalation()) {
            message.append("**Next Steps:**\n").append(nextSteps(database)).append("\n\n");
            message.append("**Decommissioning Workflow:**\n")
                    .append("1. Verify no hidden dependencies\n")
                    .append("2. Contact owner: ").append(database.getOwnerEmail()).append('\n')
                    .append("3. ").append(event.isRequiresManualReview()
                            ? "Create issue for manual review" : "Evaluate for removal").append('\n')
                    .append("4. Document decision and rationale\n\n");
        }

        message.append('@').append(database.getOwnerEmail()).append(" @").append(teamContact);
        return message.toString();
    }

    public String renderEscalation(NotificationEvent event) {
        MonitoredDatabase database = event.getDatabase();
        StringBuilder message = new StringBuilder()
                .append("**ESCALATION: Unused Database Alert**\n\n")
                .append("Database ").append(database.getId())
                .append(" has been without connections for ")
                .append(TimeUtils.formatDuration(event.getMetricValue())).append(".\n");

        if (database.getCriticality() == Criticality.CRITICAL) {
            message.append("This is a CRITICAL system requiring immediate review.\n");
        }
        if (database.getScenario() == ScenarioType.LOGIC_HEAVY) {
            message.append("Business logic depends on this database; automated removal is not permitted.\n");
        }

        message.append("\nManual disposition required before any decommissioning action.");
        return message.toString();
    }

    public IssuePayload renderIssue(NotificationEvent event) {
        MonitoredDatabase database = event.getDatabase();
        ThresholdPolicy policy = event.getPolicy();
        String scenario = database.getScenario().name();
        String criticality = database.getCriticality().name();

        String body = """
                ## Database Decommissioning Review: %s

                **Database Information:**
                - Name: %s
                - Scenario: %s
                - Criticality: %s
                - Owner: %s

                **Alert Details:**
                - Status: %s -> %s
                - No connections for %d days (threshold %d days)
                - Alert raised at: %s

                **Required Actions:**
                - [ ] Verify no hidden dependencies
                - [ ] Check application logs for references
                - [ ] Contact database owner
                - [ ] %s
                - [ ] Document decommissioning decision

                **Owner:** @%s
                """.formatted(
                database.getId(),
                database.getId(),
                scenario,
                criticality,
                database.getOwnerEmail(),
                event.getFromStatus(), event.getToStatus(),
                TimeUtils.wholeDays(event.getMetricValue()),
                TimeUtils.wholeDays(policy.getCriticalSeconds()),
                event.getOccurredAt(),
                database.getScenario() == ScenarioType.LOGIC_HEAVY
                        ? "Review business logic impact" : "Confirm safe removal",
                database.getOwnerHandle());

        return IssuePayload.builder()
                .databaseId(database.getId())
                .transitionKey(event.getTransitionKey())
                .title("Database Decommissioning Review: " + database.getId() + " (" + event.getToStatus() + ")")
                .body(body)
                .labels(List.of("database-decommissioning",
                        scenario.toLowerCase(Locale.ROOT),
                        criticality.toLowerCase(Locale.ROOT)))
                .build();
    }

    private long crossedThreshold(NotificationEvent event) {
        ThresholdPolicy policy = event.getPolicy();
        if (event.getToStatus() == AlertLevel.CRITICAL) {
            return policy.getCriticalSeconds();
        }
        if (event.getToStatus() == AlertLevel.WARNING) {
            return event.isEscalation() ? policy.getWarningSeconds() : policy.getCriticalRecoverySeconds();
        }
        return policy.getWarningRecoverySeconds();
    }

    private String nextSteps(MonitoredDatabase database) {
        if (database.getCriticality() == Criticality.CRITICAL) {
            return "**CRITICAL DATABASE** - Manual review required before any action";
        }
        switch (database.getScenario()) {
            case LOGIC_HEAVY:
                return "Logic-heavy scenario - Manual review required before any action";
            case MIXED:
                return "Mixed scenario - Check service layer dependencies";
            default:
                return database.isAutoReviewEligible()
                        ? "Config-only scenario - Safe for automated review"
                        : "Config-only scenario - Manual review requested by owner";
        }
    }
}
