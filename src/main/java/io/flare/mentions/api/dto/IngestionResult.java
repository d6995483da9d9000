package io.flare.mentions.api.dto;

import io.flare.mentions.api.exception.ErrorCategory;

import java.util.List;

public record IngestionResult(
        String keyword,
        Outcome outcome,
        int fetched,
        int skippedDuplicates,
        List<String> entryIds,
        ErrorCategory failureCategory,
        long durationMs
) {
    public enum Outcome {
        APPENDED,
        NO_MATCHES,
        ABANDONED
    }

    public int appended() {
        return entryIds.size();
    }

    public static IngestionResult appended(String keyword, int fetched, int skippedDuplicates,
                                           List<String> entryIds, long durationMs) {
        Outcome outcome = fetched == 0 ? Outcome.NO_MATCHES : Outcome.APPENDED;
        return new IngestionResult(keyword, outcome, fetched, skippedDuplicates, List.copyOf(entryIds), null, durationMs);
    }

    public static IngestionResult abandoned(String keyword, ErrorCategory category, long durationMs) {
        return new IngestionResult(keyword, Outcome.ABANDONED, 0, 0, List.of(), category, durationMs);
    }
}
