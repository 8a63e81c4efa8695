package com.plantwatch.controller;

import com.plantwatch.exception.PlantWatchException;
import com.plantwatch.exception.ValidationException;
import com.plantwatch.exception.Violation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Input problems. Log: WARN, message only.
     */
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Object> handleValidation(ValidationException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        Map<String, Object> body = body(ex.getStatus(), ex.getError(), ex.getMessage());
        body.put("detail", ex.getViolations().stream().map(GlobalExceptionHandler::detail).collect(Collectors.toList()));
        return ResponseEntity.status(ex.getStatus()).body(body);
    }

    /**
     * Not found, conflicts, failed test deliveries and store failures.
     */
    @ExceptionHandler(PlantWatchException.class)
    public ResponseEntity<Object> handlePlantWatch(PlantWatchException ex) {
        if (ex.getStatus().is5xxServerError() && ex.getStatus() != HttpStatus.BAD_GATEWAY) {
            log.error("Request failed: {}", ex.getMessage(), ex);
        } else {
            log.warn("Request rejected: {}", ex.getMessage());
        }
        return ResponseEntity.status(ex.getStatus()).body(body(ex.getStatus(), ex.getError(), ex.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Object> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return unprocessable(List.of("body"), "request body is missing or is not valid JSON", "value_error.jsondecode");
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Object> handleMissingParameter(MissingServletRequestParameterException ex) {
        log.warn("Missing parameter: {}", ex.getParameterName());
        return unprocessable(List.of("query", ex.getParameterName()), "field required", "value_error.missing");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Object> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.warn("Bad value for {}: {}", ex.getName(), ex.getValue());
        String source = ex.getParameter().hasParameterAnnotation(PathVariable.class) ? "path" : "query";
        return unprocessable(List.of(source, ex.getName()),
                "invalid value '" + ex.getValue() + "'", "type_error");
    }

    @ExceptionHandler({NoResourceFoundException.class, HttpRequestMethodNotSupportedException.class})
    public ResponseEntity<Object> handleRouting(Exception ex) {
        HttpStatus status = HttpStatus.valueOf(((ErrorResponse) ex).getStatusCode().value());
        log.warn("Routing: {}", ex.getMessage());
        return ResponseEntity.status(status).body(body(status, status.getReasonPhrase(), ex.getMessage()));
    }

    /**
     * Everything else. Log: ERROR with stack trace.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Object> handleGeneralErrors(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body(HttpStatus.INTERNAL_SERVER_ERROR,
                "Internal Server Error", "An unexpected error occurred."));
    }

    private ResponseEntity<Object> unprocessable(List<Object> loc, String msg, String type) {
        return handleValidation(new ValidationException(loc, msg, type));
    }

    private static Map<String, Object> body(HttpStatus status, String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", error);
        body.put("message", message);
        return body;
    }

    private static Map<String, Object> detail(Violation violation) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("loc", violation.getLoc());
        detail.put("msg", violation.getMsg());
        detail.put("type", violation.getType());
        return detail;
    }
}
