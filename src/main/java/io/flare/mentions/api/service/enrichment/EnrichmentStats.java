package io.flare.mentions.api.service.enrichment;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

@Component
public class EnrichmentStats {

    private final AtomicLong enriched = new AtomicLong();
    private final AtomicLong retryable = new AtomicLong();
    private final AtomicLong terminal = new AtomicLong();
    private final AtomicLong filtered = new AtomicLong();
    private final AtomicLong storeFailures = new AtomicLong();
    private final AtomicLong reclaimed = new AtomicLong();

    void recordOutcome(EntryState state) {
        switch (state) {
            case ENRICHED -> enriched.incrementAndGet();
            case FAILED_RETRYABLE -> retryable.incrementAndGet();
            case FAILED_TERMINAL -> terminal.incrementAndGet();
            case FILTERED -> filtered.incrementAndGet();
            default -> {
                // intermediate states are not counted
            }
        }
    }

    void recordStoreFailure() {
        storeFailures.incrementAndGet();
    }

    void recordReclaimed(int count) {
        reclaimed.addAndGet(count);
    }

    public Snapshot snapshot() {
        return new Snapshot(enriched.get(), retryable.get(), terminal.get(), filtered.get(),
                storeFailures.get(), reclaimed.get());
    }

    public record Snapshot(
            long enriched,
            long retryable,
            long terminal,
            long filtered,
            long storeFailures,
            long reclaimed
    ) {}
}
