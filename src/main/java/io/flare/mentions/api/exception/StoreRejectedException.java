package io.flare.mentions.api.exception;

/**
 * The database refused the row itself (constraint or value violation). Repeating the same write
 * fails the same way, so it is never retried.
 */
public class StoreRejectedException extends StoreException {

    public StoreRejectedException(String message, Throwable cause) {
        super(message, cause, ErrorCategory.INVALID_REQUEST);
    }
}
