package io.flare.mentions.api.exception;

public class StoreWriteConflictException extends StoreException {

    public StoreWriteConflictException(String message, Throwable cause) {
        super(message, cause, ErrorCategory.CONFLICT);
    }
}
