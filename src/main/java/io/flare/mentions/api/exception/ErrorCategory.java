package io.flare.mentions.api.exception;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;

public enum ErrorCategory {
    TIMEOUT,              // Connection/read timeout
    CONNECTION_REFUSED,   // Connection refused
    DNS_ERROR,            // Unknown host
    NETWORK_ERROR,        // Other network issues
    IO_ERROR,             // I/O problems
    INVALID_REQUEST,      // 400 and other client errors
    NOT_FOUND,            // 404 error
    AUTH_REQUIRED,        // 401/403 errors
    RATE_LIMITED,         // 429 Too Many Requests
    SERVER_ERROR,         // 5xx errors
    SERVER_UNAVAILABLE,   // 502/503/504, model loading
    HTTP_ERROR,           // Other HTTP errors
    PARSE_ERROR,          // Unexpected response body
    STORAGE_ERROR,        // Redis / database failures
    CONFLICT,             // Concurrent write conflict
    UNKNOWN;              // Unexpected errors

    public boolean isTransient() {
        return switch (this) {
            case TIMEOUT, CONNECTION_REFUSED, DNS_ERROR, NETWORK_ERROR, IO_ERROR,
                 RATE_LIMITED, SERVER_ERROR, SERVER_UNAVAILABLE, STORAGE_ERROR, CONFLICT -> true;
            default -> false;
        };
    }

    public static ErrorCategory fromHttpStatus(int status) {
        return switch (status) {
            case 400, 422 -> INVALID_REQUEST;
            case 401, 403 -> AUTH_REQUIRED;
            case 404 -> NOT_FOUND;
            case 408 -> TIMEOUT;
            case 429 -> RATE_LIMITED;
            case 502, 503, 504 -> SERVER_UNAVAILABLE;
            default -> {
                if (status >= 500) yield SERVER_ERROR;
                if (status >= 400) yield HTTP_ERROR;
                yield UNKNOWN;
            }
        };
    }

    public static ErrorCategory fromIOException(IOException e) {
        if (e instanceof SocketTimeoutException) return TIMEOUT;
        if (e instanceof ConnectException) return CONNECTION_REFUSED;
        if (e instanceof UnknownHostException) return DNS_ERROR;
        if (e instanceof SocketException) return NETWORK_ERROR;
        return IO_ERROR;
    }
}
