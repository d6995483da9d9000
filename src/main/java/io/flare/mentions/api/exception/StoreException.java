package io.flare.mentions.api.exception;

public abstract class StoreException extends PipelineException {

    protected StoreException(String message, Throwable cause, ErrorCategory category) {
        super(message, cause, category);
    }
}
