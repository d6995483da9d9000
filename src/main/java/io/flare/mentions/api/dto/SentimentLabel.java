package io.flare.mentions.api.dto;

import java.util.Locale;
import java.util.Optional;

public enum SentimentLabel {
    POSITIVE,
    NEUTRAL,
    NEGATIVE;

    /**
     * Maps a classifier label such as {@code "positive"} or {@code "NEGATIVE"} onto the enum.
     */
    public static Optional<SentimentLabel> fromProviderLabel(String label) {
        if (label == null || label.isBlank()) return Optional.empty();

        return switch (label.trim().toUpperCase(Locale.ROOT)) {
            case "POSITIVE", "POS" -> Optional.of(POSITIVE);
            case "NEUTRAL", "NEU" -> Optional.of(NEUTRAL);
            case "NEGATIVE", "NEG" -> Optional.of(NEGATIVE);
            default -> Optional.empty();
        };
    }
}
