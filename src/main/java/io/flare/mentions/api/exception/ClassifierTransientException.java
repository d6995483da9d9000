package io.flare.mentions.api.exception;

/**
 * Timeout, throttling or 5xx from the classifier. The entry is redelivered later.
 */
public class ClassifierTransientException extends ClassifierException {

    public ClassifierTransientException(String message, ErrorCategory category) {
        super(message, category);
    }

    public ClassifierTransientException(String message, Throwable cause, ErrorCategory category) {
        super(message, cause, category);
    }
}
