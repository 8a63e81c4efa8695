package com.plantwatch.exception;

import org.springframework.http.HttpStatus;

/**
 * The store rejected a write for a reason unrelated to the input. Nothing was
 * committed and the caller may retry the same batch.
 */
public class TransientStoreException extends PlantWatchException {

    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
