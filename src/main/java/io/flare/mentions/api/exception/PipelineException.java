package io.flare.mentions.api.exception;

/**
 * Base class for every failure the ingestion and enrichment pipeline raises.
 */
public abstract class PipelineException extends RuntimeException {

    private final ErrorCategory category;

    protected PipelineException(String message, ErrorCategory category) {
        super(message);
        this.category = category;
    }

    protected PipelineException(String message, Throwable cause, ErrorCategory category) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
