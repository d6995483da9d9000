package io.flare.mentions.api.exception;

public abstract class ClassifierException extends PipelineException {

    protected ClassifierException(String message, ErrorCategory category) {
        super(message, category);
    }

    protected ClassifierException(String message, Throwable cause, ErrorCategory category) {
        super(message, cause, category);
    }
}
