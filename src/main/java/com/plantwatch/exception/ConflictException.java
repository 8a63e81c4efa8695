package com.plantwatch.exception;

import org.springframework.http.HttpStatus;

public class ConflictException extends PlantWatchException {

    public ConflictException(String message) {
        super(message);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.CONFLICT;
    }
}
