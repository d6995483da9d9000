package io.flare.mentions.api.dto.kafka;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.flare.mentions.api.dto.IngestionResult;

import java.time.Instant;

public record IngestionBatchEvent(
        @JsonProperty("batchId") String batchId,
        @JsonProperty("keyword") String keyword,
        @JsonProperty("trigger") String trigger,
        @JsonProperty("outcome") IngestionResult.Outcome outcome,
        @JsonProperty("fetchedArticles") int fetchedArticles,
        @JsonProperty("appendedArticles") int appendedArticles,
        @JsonProperty("skippedDuplicates") int skippedDuplicates,
        @JsonProperty("processingDurationMs") long processingDurationMs,
        @JsonProperty("processedAt") Instant processedAt
) {
    public static IngestionBatchEvent create(String trigger, IngestionResult result) {
        return new IngestionBatchEvent(
                "BATCH-" + System.currentTimeMillis(),
                result.keyword(),
                trigger,
                result.outcome(),
                result.fetched(),
                result.appended(),
                result.skippedDuplicates(),
                result.durationMs(),
                Instant.now()
        );
    }
}
