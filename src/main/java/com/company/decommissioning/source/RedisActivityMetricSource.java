package com.company.decommissioning.source;

import com.company.decommissioning.domain.ActivitySnapshot;
import com.company.decommissioning.exception.MetricFetchException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;

/**
 * Reads activity samples written by the connection exporter.
 *
 * <ul>
 *   <li>{@code decom:activity:{database}}: sorted set, score = sample epoch millis,
 *       member = sample JSON</li>
 *   <li>{@code decom:activity:last_active}: hash, database -> epoch millis of the last
 *       non-zero sample ever seen</li>
 * </ul>
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RedisActivityMetricSource implements ActivityMetricSource {

    static final String SAMPLES_KEY_PREFIX = "decom:activity:";
    static final String LAST_ACTIVE_HASH = "decom:activity:last_active";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public ActivitySnapshot fetchActivity(String databaseId, Duration window) {
        try {
            long now = clock.millis();
            long from = now - window.toMillis();

            Set<String> members = redisTemplate.opsForZSet()
                    .rangeByScore(SAMPLES_KEY_PREFIX + databaseId, from, now);

            if (members == null || members.isEmpty()) {
                log.debug("No activity samples for {} in the last {}", databaseId, window);
                return ActivitySnapshot.noData();
            }

            Instant lastActiveAt = null;
            for (String member : members) {
                ActivitySample sample = objectMapper.readValue(member, ActivitySample.class);
                if (sample.isActive()) {
                    Instant sampledAt = Instant.ofEpochMilli(sample.getTimestamp());
                    if (lastActiveAt == null || sampledAt.isAfter(lastActiveAt)) {
                        lastActiveAt = sampledAt;
                    }
                }
            }

            if (lastActiveAt == null) {
                lastActiveAt = storedLastActive(databaseId);
            }

            return ActivitySnapshot.of(lastActiveAt, members.size());

        } catch (JsonProcessingException | RuntimeException e) {
            throw new MetricFetchException(databaseId, e);
        }
    }

    private Instant storedLastActive(String databaseId) {
        Object stored = redisTemplate.opsForHash().get(LAST_ACTIVE_HASH, databaseId);
        if (stored == null) {
            return null;
        }
        try {
            return Instant.ofEpochMilli(Long.parseLong(stored.toString()));
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed last-active value '{}' for {}", stored, databaseId);
            return null;
        }
    }
}
