package io.flare.mentions.config;

public record RetryConfig(
        BackoffConfig source,
        BackoffConfig store
) {}
