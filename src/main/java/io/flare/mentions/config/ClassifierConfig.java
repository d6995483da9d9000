package io.flare.mentions.config;

public record ClassifierConfig(
        String endpoint,
        String apiKey,
        HttpConfig http
) {}
