package io.flare.mentions.config;

import java.time.Duration;

public record StreamConfig(
        String key,
        String consumerGroup,
        String consumerPrefix,
        int batchSize,
        Duration blockTimeout,
        Duration idleThreshold,
        Duration reclaimInterval,
        Duration errorBackoff
) {}
