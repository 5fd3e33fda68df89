package com.trackshelf.backend.shared;

import org.springframework.http.HttpStatus;

/**
 * Base for every error the API reports to clients. The message is returned as-is in the
 * {@code detail} field, so it must never carry internal details.
 */
public abstract class ApiException extends RuntimeException {

    private final HttpStatus status;

    protected ApiException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    protected ApiException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
