package io.flare.mentions.api.exception;

public class UpstreamQuotaExceededException extends UpstreamException {

    public UpstreamQuotaExceededException(String message) {
        super(message, ErrorCategory.RATE_LIMITED);
    }
}
