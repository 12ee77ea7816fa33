package com.company.decommissioning.config;

import com.company.decommissioning.domain.DatabaseDefinition;
import com.company.decommissioning.domain.enums.Criticality;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Settings under the {@code decommissioning} prefix.
 */
@Data
@ConfigurationProperties(prefix = "decommissioning")
public class DecommissioningProperties {

    /** Monitored databases as supplied by the infrastructure metadata. */
    private List<DatabaseDefinition> databases = new ArrayList<>();

    /** Trigger windows per threshold tier. */
    private Map<Criticality, Window> windows = defaultWindows();

    /** Fraction of the warning window below which a WARNING clears. */
    private double warningRecoveryRatio = 0.8;

    /** Fraction of the critical window below which a CRITICAL drops back to WARNING. */
    private double criticalRecoveryRatio = 0.8;

    /** Silence from the metric source longer than this counts as maximal inactivity. */
    private Duration noDataWindow = Duration.ofHours(24);

    private Evaluation evaluation = new Evaluation();
    private MetricSource metricSource = new MetricSource();
    private Webhook webhook = new Webhook();
    private Issues issues = new Issues();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Window {
        private Duration critical;
        private Duration warning;
    }

    @Data
    public static class Evaluation {
        private boolean enabled = true;
        /** Look-back window handed to the metric source. */
        private Duration window = Duration.ofMinutes(30);
        private int concurrency = 4;
        private int queueCapacity = 500;
    }

    @Data
    public static class MetricSource {
        private Duration timeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Webhook {
        private boolean enabled = true;
        private String url = "https://automation.company.com/database-decommissioning/webhook";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(10);
        private int maxAttempts = 4;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private double backoffMultiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(30);
    }

    @Data
    public static class Issues {
        /** How long a created-issue claim is remembered. */
        private Duration claimTtl = Duration.ofDays(90);
        private GitHub github = new GitHub();
    }

    @Data
    public static class GitHub {
        private boolean enabled = false;
        private String apiUrl = "https://api.github.com";
        private String repository = "company/database-decommissioning";
        private String token;
    }

    private static Map<Criticality, Window> defaultWindows() {
        Map<Criticality, Window> windows = new EnumMap<>(Criticality.class);
        windows.put(Criticality.CRITICAL, new Window(Duration.ofHours(24), Duration.ofHours(12)));
        windows.put(Criticality.MEDIUM, new Window(Duration.ofDays(3), Duration.ofDays(2)));
        windows.put(Criticality.LOW, new Window(Duration.ofDays(30), Duration.ofDays(21)));
        return windows;
    }
}
