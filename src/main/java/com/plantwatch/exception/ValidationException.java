package com.plantwatch.exception;

import org.springframework.http.HttpStatus;

import java.util.List;

public class ValidationException extends PlantWatchException {

    private final List<Violation> violations;

    public ValidationException(List<Violation> violations) {
        super(summarize(violations));
        this.violations = List.copyOf(violations);
    }

    public ValidationException(List<Object> loc, String msg, String type) {
        this(List.of(new Violation(loc, msg, type)));
    }

    public List<Violation> getViolations() {
        return violations;
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.UNPROCESSABLE_ENTITY;
    }

    @Override
    public String getError() {
        return "Validation Failed";
    }

    private static String summarize(List<Violation> violations) {
        if (violations.size() == 1) {
            return violations.get(0).getMsg();
        }
        return violations.size() + " validation errors";
    }
}
