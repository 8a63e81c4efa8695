package com.plantwatch.exception;

import org.springframework.http.HttpStatus;

public class DispatchException extends PlantWatchException {

    public DispatchException(String message) {
        super(message);
    }

    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.BAD_GATEWAY;
    }
}
