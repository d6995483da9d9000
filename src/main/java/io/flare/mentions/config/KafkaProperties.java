package io.flare.mentions.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "kafka.topics")
public record KafkaProperties(
        String mentionChanged,
        String ingestionBatch
) {}
