package io.flare.mentions.api.service.enrichment;

import io.flare.mentions.config.MentionsConfig;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;

@Service
public class RedisFailureCounter implements FailureCounter {

    private static final String FAILURE_PREFIX = "mentions:enrich:failures:";

    private final RedisTemplate<String, String> redisTemplate;
    private final Duration ttl;

    public RedisFailureCounter(RedisTemplate<String, String> redisTemplate, MentionsConfig config) {
        this.redisTemplate = redisTemplate;
        this.ttl = config.enrichment().failureTtl();
    }

    @Override
    public long recordFailure(String entryId) {
        String key = FAILURE_PREFIX + entryId;

        Long failures = redisTemplate.opsForValue().increment(key);
        redisTemplate.expire(key, ttl);

        return failures != null ? failures : 1L;
    }

    @Override
    public void clear(String entryId) {
        redisTemplate.delete(FAILURE_PREFIX + entryId);
    }
}
