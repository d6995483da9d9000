package io.flare.mentions.api.exception;

/**
 * Article-search provider failure. Retried with backoff by the ingestion cycle.
 */
public abstract class UpstreamException extends PipelineException {

    protected UpstreamException(String message, ErrorCategory category) {
        super(message, category);
    }

    protected UpstreamException(String message, Throwable cause, ErrorCategory category) {
        super(message, cause, category);
    }
}
