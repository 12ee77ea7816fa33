package com.company.decommissioning.service;

import com.company.decommissioning.config.DecommissioningProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Remembers which transitions already produced an issue, so a re-dispatch cannot open a
 * second ticket. Claims are atomic ({@code SET NX}) and shared across instances.
 */
@Component
@Slf4j
public class IssueLedger {

    private static final String KEY_PREFIX = "decom:issue:";
    private static final String PENDING = "PENDING";

    private final StringRedisTemplate redisTemplate;
    private final Duration claimTtl;

    public IssueLedger(StringRedisTemplate redisTemplate, DecommissioningProperties properties) {
        this.redisTemplate = redisTemplate;
        this.claimTtl = properties.getIssues().getClaimTtl();
    }

    /**
     * @return true if this caller now owns issue creation for the transition
     */
    public boolean claim(String transitionKey) {
        Boolean claimed = redisTemplate.opsForValue().setIfAbsent(KEY_PREFIX + transitionKey, PENDING, claimTtl);
        return Boolean.TRUE.equals(claimed);
    }

    public void markCreated(String transitionKey, String issueReference) {
        redisTemplate.opsForValue().set(KEY_PREFIX + transitionKey, issueReference, claimTtl);
    }

    /**
     * Gives up a claim after a failed submission so a later dispatch may try again.
     */
    public void release(String transitionKey) {
        redisTemplate.delete(KEY_PREFIX + transitionKey);
        log.debug("Released issue claim {}", transitionKey);
    }
}
