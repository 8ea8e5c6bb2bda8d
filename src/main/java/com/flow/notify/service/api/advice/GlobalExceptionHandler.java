package com.flow.notify.service.api.advice;

import com.flow.notify.service.api.dto.ApiResponse;
import com.flow.notify.service.engine.NotifyEngineException;
import com.flow.notify.service.registry.ConfigurationException;
import com.flow.notify.service.throttle.ThrottledException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Global exception handler for REST controllers.
 *
 * Provides consistent error responses across all endpoints.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private final Clock clock;

    public GlobalExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    /**
     * Handles validation errors.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidationException(
            MethodArgumentNotValidException ex) {

        List<String> violations = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .toList();

        log.warn("Validation error: {}", violations);

        return ResponseEntity.badRequest()
                .body(ApiResponse.error("Validation failed", "VALIDATION_ERROR", null, violations));
    }

    /**
     * Handles unreadable bodies, such as an unknown policy type or a missing required field.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        String detail = ex.getMostSpecificCause().getMessage();
        log.warn("Unreadable request body: {}", detail);

        return ResponseEntity.badRequest()
                .body(ApiResponse.error("Malformed request body", "VALIDATION_ERROR", null, List.of(detail)));
    }

    /**
     * Handles configuration rejected at save time.
     */
    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ApiResponse<Void>> handleConfigurationException(ConfigurationException ex) {
        log.warn("Configuration rejected: id={}, violations={}", ex.getEntityId(), ex.getViolations());

        return ResponseEntity.badRequest()
                .body(ApiResponse.error("Invalid configuration", ex.getErrorCode(), ex.getEntityId(),
                        ex.getViolations()));
    }

    /**
     * Handles throttles configured to raise errors.
     */
    @ExceptionHandler(ThrottledException.class)
    public ResponseEntity<ApiResponse<Void>> handleThrottledException(ThrottledException ex) {
        log.debug("Throttled: {}", ex.getMessage());

        ApiResponse<Void> body = ApiResponse.error(ex.getMessage(), ex.getErrorCode(), ex.getEntityId(), null);
        body.getError().setRetryAt(ex.getRetryAt());

        ResponseEntity.BodyBuilder builder = ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS);
        if (ex.getRetryAt() != null) {
            long seconds = Math.max(1, Duration.between(clock.instant(), ex.getRetryAt()).toSeconds());
            builder.header(HttpHeaders.RETRY_AFTER, Long.toString(seconds));
        }
        return builder.body(body);
    }

    /**
     * Handles engine exceptions.
     */
    @ExceptionHandler(NotifyEngineException.class)
    public ResponseEntity<ApiResponse<Void>> handleEngineException(NotifyEngineException ex) {
        HttpStatus status = switch (ex.getErrorCode()) {
            case "INCIDENT_NOT_FOUND", "CONFIG_NOT_FOUND" -> HttpStatus.NOT_FOUND;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };

        if (status.is5xxServerError()) {
            log.error("Engine error: {} [{}]", ex.getMessage(), ex.getErrorCode(), ex);
        } else {
            log.debug("Engine error: {} [{}]", ex.getMessage(), ex.getErrorCode());
        }

        return ResponseEntity.status(status)
                .body(ApiResponse.error(ex.getMessage(), ex.getErrorCode(), ex.getEntityId(), null));
    }

    /**
     * Handles resource not found.
     */
    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNoResourceFoundException(
            NoResourceFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error("Resource not found", "NOT_FOUND"));
    }

    /**
     * Handles malformed path or query parameters.
     */
    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiResponse<Void>> handleIllegalArgumentException(Exception ex) {
        log.warn("Illegal argument: {}", ex.getMessage());

        return ResponseEntity.badRequest()
                .body(ApiResponse.error(ex.getMessage(), "INVALID_ARGUMENT"));
    }

    /**
     * Handles all other exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error("An unexpected error occurred", "INTERNAL_ERROR", null,
                        List.of(String.valueOf(ex.getMessage()))));
    }
}
