package io.flare.mentions.api.service.enrichment;

/**
 * Counts transient enrichment failures per stream entry across redeliveries and workers.
 */
public interface FailureCounter {

    /**
     * Records one more failure and returns the total so far.
     */
    long recordFailure(String entryId);

    void clear(String entryId);
}
