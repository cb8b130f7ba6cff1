package junie.email.intel.controller;

import junie.email.intel.service.DigestCancelledException;
import junie.email.intel.service.InvalidEmailRecordException;
import junie.email.intel.service.InvalidPreferencesException;
import junie.email.intel.service.NotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class ErrorHandler {

    @ExceptionHandler(InvalidEmailRecordException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidEmail(InvalidEmailRecordException ex) {
        return body("INVALID_EMAIL_RECORD", ex.getMessage());
    }

    @ExceptionHandler(InvalidPreferencesException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidPreferences(InvalidPreferencesException ex) {
        return body("INVALID_PREFERENCES", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleIllegalArgument(IllegalArgumentException ex) {
        return body("BAD_REQUEST", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getField)
                .map(field -> field + " is invalid")
                .collect(Collectors.joining(", "));
        return body("VALIDATION_FAILED", message);
    }

    @ExceptionHandler(NotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(NotFoundException ex) {
        return body("NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(DigestCancelledException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Map<String, Object> handleDigestCancelled(DigestCancelledException ex) {
        log.warn("Digest request cancelled: {}", ex.getMessage());
        return body("DIGEST_CANCELLED", ex.getMessage());
    }

    private static Map<String, Object> body(String code, String message) {
        return Map.of("code", code, "message", message != null ? message : "");
    }
}
