package com.company.decommissioning.service;

import com.company.decommissioning.config.DecommissioningProperties;
import com.company.decommissioning.domain.IssuePayload;
import com.company.decommissioning.domain.enums.DeliveryChannel;
import com.company.decommissioning.exception.DeliveryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
@ConditionalOnProperty(
        value = "decommissioning.issues.github.enabled",
        havingValue = "true"
)
public class GitHubIssueTrackerClient implements IssueTrackerClient {

    private static final ParameterizedTypeReference<Map<String, Object>> ISSUE_RESPONSE =
            new ParameterizedTypeReference<>() { };

    private final RestTemplate restTemplate;
    private final DecommissioningProperties.GitHub github;

    public GitHubIssueTrackerClient(RestTemplate restTemplate, DecommissioningProperties properties) {
        this.restTemplate = restTemplate;
        this.github = properties.getIssues().getGithub();
    }

    @Override
    public String createIssue(IssuePayload issue) {
        String url = github.getApiUrl() + "/repos/" + github.getRepository() + "/issues";

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.parseMediaType("application/vnd.github+json")));
        if (github.getToken() != null && !github.getToken().isBlank()) {
            headers.setBearerAuth(github.getToken());
        }

        Map<String, Object> body = new HashMap<>();
        body.put("title", issue.getTitle());
        body.put("body", issue.getBody());
        body.put("labels", issue.getLabels());

        try {
            ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
                    url, HttpMethod.POST, new HttpEntity<>(body, headers), ISSUE_RESPONSE);

            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
                throw new DeliveryException(DeliveryChannel.ISSUE_TRACKER,
                        "GitHub returned " + response.getStatusCode().value() + " for " + issue.getDatabaseId());
            }

            Object htmlUrl = response.getBody().get("html_url");
            log.info("Created GitHub issue {} for database {}", htmlUrl, issue.getDatabaseId());
            return htmlUrl != null ? htmlUrl.toString() : github.getRepository();

        } catch (RestClientException e) {
            throw new DeliveryException(DeliveryChannel.ISSUE_TRACKER,
                    "GitHub issue creation failed for " + issue.getDatabaseId() + ": " + e.getMessage(), e);
        }
    }
}
