package com.company.decommissioning.source;

import com.company.decommissioning.domain.ActivitySnapshot;
import com.company.decommissioning.exception.MetricFetchException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("RedisActivityMetricSource Unit Tests")
class RedisActivityMetricSourceTest {

    private static final Instant NOW = Instant.parse("2024-03-10T12:00:00Z");
    private static final Duration WINDOW = Duration.ofMinutes(30);

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ZSetOperations<String, String> zSetOperations;

    @Mock
    private HashOperations<String, Object, Object> hashOperations;

    private RedisActivityMetricSource source;

    @BeforeEach
    void setUp() {
        source = new RedisActivityMetricSource(redisTemplate, new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
        when(redisTemplate.opsForZSet()).thenReturn(zSetOperations);
    }

    private static String sample(Instant at, long connections, long queries) {
        return String.format("{\"timestamp\":%d,\"activeConnections\":%d,\"queryCount\":%d,\"exporter\":\"pg\"}",
                at.toEpochMilli(), connections, queries);
    }

    private void samples(String... members) {
        long from = NOW.minus(WINDOW).toEpochMilli();
        when(zSetOperations.rangeByScore("decom:activity:pagila", from, NOW.toEpochMilli()))
                .thenReturn(new LinkedHashSet<>(List.of(members)));
    }

    @Test
    @DisplayName("Latest active sample in the window becomes the last activity")
    void shouldPickLatestActiveSample() {
        samples(
                sample(NOW.minusSeconds(1200), 3, 40),
                sample(NOW.minusSeconds(600), 1, 0),
                sample(NOW.minusSeconds(60), 0, 0));

        ActivitySnapshot snapshot = source.fetchActivity("pagila", WINDOW);

        assertThat(snapshot.isNoData()).isFalse();
        assertThat(snapshot.getSampleCount()).isEqualTo(3);
        assertThat(snapshot.getLastActiveAt()).isEqualTo(NOW.minusSeconds(600));
        verify(redisTemplate, never()).opsForHash();
    }

    @Test
    @DisplayName("Idle samples fall back to the stored last-active marker")
    void shouldFallBackToLastActiveHash() {
        samples(sample(NOW.minusSeconds(300), 0, 0));
        Instant lastActive = NOW.minus(Duration.ofDays(4));
        when(redisTemplate.<Object, Object>opsForHash()).thenReturn(hashOperations);
        when(hashOperations.get("decom:activity:last_active", "pagila"))
                .thenReturn(String.valueOf(lastActive.toEpochMilli()));

        ActivitySnapshot snapshot = source.fetchActivity("pagila", WINDOW);

        assertThat(snapshot.isNoData()).isFalse();
        assertThat(snapshot.getLastActiveAt()).isEqualTo(lastActive);
    }

    @Test
    @DisplayName("Never-active databases report samples without a last activity")
    void shouldReportUnknownLastActivity() {
        samples(sample(NOW.minusSeconds(300), 0, 0));
        when(redisTemplate.<Object, Object>opsForHash()).thenReturn(hashOperations);
        when(hashOperations.get("decom:activity:last_active", "pagila")).thenReturn(null);

        ActivitySnapshot snapshot = source.fetchActivity("pagila", WINDOW);

        assertThat(snapshot.getLastActiveAt()).isNull();
        assertThat(snapshot.getSampleCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("An empty window is no data")
    void emptyWindowIsNoData() {
        samples();

        assertThat(source.fetchActivity("pagila", WINDOW).isNoData()).isTrue();
    }

    @Test
    @DisplayName("Redis failures surface as MetricFetchException")
    void redisFailureIsWrapped() {
        long from = NOW.minus(WINDOW).toEpochMilli();
        when(zSetOperations.rangeByScore("decom:activity:pagila", from, NOW.toEpochMilli()))
                .thenThrow(new RedisConnectionFailureException("connection refused"));

        assertThatThrownBy(() -> source.fetchActivity("pagila", WINDOW))
                .isInstanceOf(MetricFetchException.class)
                .hasMessageContaining("pagila")
                .hasCauseInstanceOf(RedisConnectionFailureException.class);
    }

    @Test
    @DisplayName("Malformed samples surface as MetricFetchException")
    void malformedSampleIsWrapped() {
        samples("not-json");

        assertThatThrownBy(() -> source.fetchActivity("pagila", WINDOW))
                .isInstanceOf(MetricFetchException.class);
    }
}
