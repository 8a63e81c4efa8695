package com.plantwatch.exception;

import org.springframework.http.HttpStatus;

/**
 * Root of the service's error taxonomy. Each subtype carries the HTTP status
 * it renders as.
 */
public abstract class PlantWatchException extends RuntimeException {

    protected PlantWatchException(String message) {
        super(message);
    }

    protected PlantWatchException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract HttpStatus getStatus();

    /** Short reason phrase used as the {@code error} field of the response body. */
    public String getError() {
        return getStatus().getReasonPhrase();
    }
}
