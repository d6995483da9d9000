package io.flare.mentions.api.exception;

public class UpstreamUnavailableException extends UpstreamException {

    public UpstreamUnavailableException(String message, ErrorCategory category) {
        super(message, category);
    }

    public UpstreamUnavailableException(String message, Throwable cause, ErrorCategory category) {
        super(message, cause, category);
    }
}
