package io.flare.mentions.api.exception;

/**
 * The stream log rejected an append. Nothing from the batch was written.
 */
public class LogAppendException extends PipelineException {

    public LogAppendException(String message) {
        super(message, ErrorCategory.STORAGE_ERROR);
    }

    public LogAppendException(String message, Throwable cause) {
        super(message, cause, ErrorCategory.STORAGE_ERROR);
    }
}
