package com.wingz.api.ride.service.exception;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.wingz.api.ride.service.dto.ErrorResponse;
import com.wingz.api.shared.exception.ApiException;
import com.wingz.api.shared.exception.ForbiddenException;
import com.wingz.api.shared.exception.NotFoundException;
import com.wingz.api.shared.exception.UnauthenticatedException;
import com.wingz.api.shared.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps the error taxonomy onto HTTP statuses with a uniform body.
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class ApiExceptionHandler {

    private static final PropertyNamingStrategies.NamingBase FIELD_NAMES = new PropertyNamingStrategies.SnakeCaseStrategy();

    private final Clock clock;

    @ExceptionHandler(UnauthenticatedException.class)
    public ResponseEntity<ErrorResponse> handleUnauthenticated(UnauthenticatedException e) {
        return build(HttpStatus.UNAUTHORIZED, e, Collections.emptyMap());
    }

    @ExceptionHandler(ForbiddenException.class)
    public ResponseEntity<ErrorResponse> handleForbidden(ForbiddenException e) {
        return build(HttpStatus.FORBIDDEN, e, Collections.emptyMap());
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e) {
        log.debug("Not found: {}", e.getMessage());
        return build(HttpStatus.NOT_FOUND, e, Collections.emptyMap());
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException e) {
        log.info("Rejected request: {} {}", e.getMessage(), e.getFieldErrors());
        return build(HttpStatus.BAD_REQUEST, e, e.getFieldErrors());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException e) {
        Map<String, String> details = new LinkedHashMap<>();
        for (FieldError error : e.getBindingResult().getFieldErrors()) {
            // Report fields under their wire names
            details.putIfAbsent(FIELD_NAMES.translate(error.getField()), error.getDefaultMessage());
        }
        log.info("Rejected request body: {}", details);
        return build(HttpStatus.BAD_REQUEST, "Request body failed validation", details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        Throwable cause = e.getMostSpecificCause();
        log.info("Unreadable request body: {}", cause.getMessage());

        JsonMappingException mapping = findMappingException(e);
        String field = mapping == null ? null : lastFieldName(mapping.getPath());
        if (field == null) {
            return build(HttpStatus.BAD_REQUEST, "Malformed request body", Collections.emptyMap());
        }
        // Creator failures carry the readable reason as the root cause
        String reason = cause instanceof JsonMappingException
                ? ((JsonMappingException) cause).getOriginalMessage()
                : cause.getMessage();
        if (reason == null) {
            reason = "invalid value";
        }
        return build(HttpStatus.BAD_REQUEST, "Invalid value for " + field, Map.of(field, reason));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return build(HttpStatus.BAD_REQUEST, "Invalid value for " + e.getName(),
                Map.of(e.getName(), "invalid value: " + e.getValue()));
    }

    private static JsonMappingException findMappingException(Throwable error) {
        for (Throwable current = error.getCause(); current != null; current = current.getCause()) {
            if (current instanceof JsonMappingException) {
                return (JsonMappingException) current;
            }
        }
        return null;
    }

    private static String lastFieldName(List<JsonMappingException.Reference> path) {
        for (int i = path.size() - 1; i >= 0; i--) {
            String name = path.get(i).getFieldName();
            if (name != null) {
                return FIELD_NAMES.translate(name);
            }
        }
        return null;
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, ApiException e, Map<String, String> details) {
        return build(status, e.getMessage(), details);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String message, Map<String, String> details) {
        ErrorResponse body = ErrorResponse.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .details(details)
                .timestamp(ZonedDateTime.now(clock).withZoneSameInstant(ZoneOffset.UTC))
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
