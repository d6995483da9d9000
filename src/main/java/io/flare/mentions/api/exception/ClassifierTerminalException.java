package io.flare.mentions.api.exception;

/**
 * The classifier will never accept this input. The article is stored unenriched.
 */
public class ClassifierTerminalException extends ClassifierException {

    public ClassifierTerminalException(String message, ErrorCategory category) {
        super(message, category);
    }

    public ClassifierTerminalException(String message, Throwable cause, ErrorCategory category) {
        super(message, cause, category);
    }
}
