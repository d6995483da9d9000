package io.flare.mentions.config;

import java.time.Duration;

public record BackoffConfig(
        Duration initialInterval,
        Duration maxInterval,
        double multiplier,
        double jitter,
        int maxAttempts
) {}
