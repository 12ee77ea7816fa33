package com.company.decommissioning.service;

import com.company.decommissioning.config.DecommissioningProperties;
import com.company.decommissioning.domain.WebhookPayload;
import com.company.decommissioning.domain.enums.DeliveryChannel;
import com.company.decommissioning.exception.DeliveryException;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Posts decommissioning payloads to the workflow automation webhook. A single attempt;
 * retrying is the caller's concern.
 */
@Component
@Slf4j
public class WebhookSender {

    private final RestTemplate restTemplate;
    private final Tracer tracer;
    private final String webhookUrl;

    public WebhookSender(RestTemplate restTemplate, Tracer tracer, DecommissioningProperties properties) {
        this.restTemplate = restTemplate;
        this.tracer = tracer;
        this.webhookUrl = properties.getWebhook().getUrl();
    }

    public void send(WebhookPayload payload) {
        Span span = tracer.spanBuilder("decommissioning.webhook.deliver")
                .setSpanKind(SpanKind.CLIENT)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("database.name", payload.getDatabaseName());
            span.setAttribute("database.scenario", payload.getScenarioType());
            span.setAttribute("requires_manual_review", payload.isRequiresManualReview());

            ResponseEntity<String> response = restTemplate.postForEntity(webhookUrl, payload, String.class);

            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new DeliveryException(DeliveryChannel.WEBHOOK,
                        "Webhook returned " + response.getStatusCode().value() + " for " + payload.getDatabaseName());
            }

            span.setAttribute("http.status_code", response.getStatusCode().value());
            log.info("Webhook delivered for database {}", payload.getDatabaseName());

        } catch (RestClientException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Webhook delivery failed");
            throw new DeliveryException(DeliveryChannel.WEBHOOK,
                    "Webhook delivery failed for " + payload.getDatabaseName() + ": " + e.getMessage(), e);
        } catch (DeliveryException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;
        } finally {
            span.end();
        }
    }
}
