package com.analysiswatch.backend;

/**
 * Raised when a backend request cannot be completed or its body cannot be parsed.
 * HTTP error statuses are not exceptions; they are reported through {@link ApiResponse}.
 */
public class BackendApiException extends RuntimeException {

    public BackendApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
