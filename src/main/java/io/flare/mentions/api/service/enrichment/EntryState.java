package io.flare.mentions.api.service.enrichment;

/**
 * Lifecycle of one stream entry inside a worker.
 */
public enum EntryState {
    CLAIMED,
    CLASSIFYING,
    ENRICHED,
    FAILED_RETRYABLE,
    FAILED_TERMINAL,
    /** Dropped by the noise filter without classification or storage. */
    FILTERED
}
