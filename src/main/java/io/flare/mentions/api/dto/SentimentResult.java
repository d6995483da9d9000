package io.flare.mentions.api.dto;

public record SentimentResult(
        SentimentLabel label,
        double score
) {}
