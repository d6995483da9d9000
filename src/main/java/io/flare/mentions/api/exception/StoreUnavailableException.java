package io.flare.mentions.api.exception;

public class StoreUnavailableException extends StoreException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause, ErrorCategory.STORAGE_ERROR);
    }
}
