package com.spinrank.tournament.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request binding failures: invalid bodies, unreadable JSON, bad path variables and missing query parameters.
 */
@RestControllerAdvice
public class ValidationExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ValidationExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ValidationErrorResponse> handle(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            fieldErrors.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage());
        }
        ex.getBindingResult().getGlobalErrors().forEach(globalError ->
                fieldErrors.putIfAbsent(globalError.getObjectName(), globalError.getDefaultMessage()));

        String detail = fieldErrors.isEmpty()
                ? "Request validation failed"
                : "Request validation failed: " + String.join("; ", fieldErrors.values());
        log.debug("Rejected request body: {}", detail);
        return ResponseEntity.badRequest().body(new ValidationErrorResponse(detail, fieldErrors));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ValidationErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest().body(new ValidationErrorResponse("Malformed request body", Map.of()));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ValidationErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String message = "Invalid value '" + ex.getValue() + "' for " + ex.getName();
        return ResponseEntity.badRequest().body(new ValidationErrorResponse(message, Map.of(ex.getName(), message)));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ValidationErrorResponse> handleMissingParameter(MissingServletRequestParameterException ex) {
        String message = ex.getParameterName() + " is required";
        return ResponseEntity.badRequest()
                .body(new ValidationErrorResponse(message, Map.of(ex.getParameterName(), message)));
    }

    public record ValidationErrorResponse(
            String detail,
            Map<String, String> fieldErrors
    ) {
    }
}
