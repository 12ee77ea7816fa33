package com.company.decommissioning.service;

import com.company.decommissioning.config.DecommissioningProperties;
import com.company.decommissioning.domain.WebhookPayload;
import com.company.decommissioning.domain.enums.DeliveryChannel;
import com.company.decommissioning.exception.DeliveryException;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("WebhookSender Unit Tests")
class WebhookSenderTest {

    private static final String URL = "https://automation.company.com/database-decommissioning/webhook";

    private MockRestServiceServer server;
    private WebhookSender sender;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();

        DecommissioningProperties properties = new DecommissioningProperties();
        properties.getWebhook().setUrl(URL);
        sender = new WebhookSender(restTemplate, OpenTelemetry.noop().getTracer("test"), properties);
    }

    private static WebhookPayload payload() {
        return WebhookPayload.builder()
                .databaseName("employees")
                .scenarioType("LOGIC_HEAVY")
                .criticality("CRITICAL")
                .ownerEmail("hr-team@company.com")
                .alertTimestamp(Instant.parse("2024-03-10T12:00:00Z"))
                .metricValue(86_400)
                .requiresManualReview(true)
                .build();
    }

    @Test
    @DisplayName("Should POST the snake_case JSON contract")
    void shouldPostPayload() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.database_name").value("employees"))
                .andExpect(jsonPath("$.scenario_type").value("LOGIC_HEAVY"))
                .andExpect(jsonPath("$.criticality").value("CRITICAL"))
                .andExpect(jsonPath("$.owner_email").value("hr-team@company.com"))
                .andExpect(jsonPath("$.metric_value").value(86_400))
                .andExpect(jsonPath("$.requires_manual_review").value(true))
                .andExpect(jsonPath("$.alert_timestamp").exists())
                .andRespond(withSuccess());

        sender.send(payload());

        server.verify();
    }

    @Test
    @DisplayName("Non-2xx responses become webhook delivery failures")
    void serverErrorIsDeliveryFailure() {
        server.expect(requestTo(URL))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThatThrownBy(() -> sender.send(payload()))
                .isInstanceOf(DeliveryException.class)
                .satisfies(e -> assertThat(((DeliveryException) e).getChannel()).isEqualTo(DeliveryChannel.WEBHOOK))
                .hasMessageContaining("employees");
    }
}
