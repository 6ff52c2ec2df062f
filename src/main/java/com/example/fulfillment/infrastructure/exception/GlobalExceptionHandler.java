package com.example.fulfillment.infrastructure.exception;

import com.example.fulfillment.application.exception.ExternalServiceException;
import com.example.fulfillment.domain.exception.IllegalTransitionException;
import com.example.fulfillment.domain.exception.InvalidOrderException;
import com.example.fulfillment.domain.exception.OrderNotFoundException;
import com.example.fulfillment.domain.exception.StaleStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API.
 * <p>
 * External failures are reported with a generic message; the cause is in
 * the log and, for payment and shipment paths, in an operator alert.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String RETRY_MESSAGE = "The request could not be completed right now. "
            + "Please try again later or contact support.";

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(WebExchangeBindException ex) {
        String message = ex.getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Invalid request: {}", message);
        return error(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", message);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(ServerWebInputException ex) {
        log.warn("Unreadable request: {}", ex.getReason());
        return error(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", "Malformed request body");
    }

    @ExceptionHandler({InvalidOrderException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> handleInvalidRequest(RuntimeException ex) {
        log.warn("Invalid request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", ex.getMessage());
    }

    @ExceptionHandler(OrderNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(OrderNotFoundException ex) {
        log.warn("Order not found: {}", ex.getMessage());
        return error(HttpStatus.NOT_FOUND, "ORDER_NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler({StaleStateException.class, IllegalTransitionException.class, IllegalStateException.class})
    public ResponseEntity<Map<String, Object>> handleStateConflict(RuntimeException ex) {
        log.warn("Order state conflict: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, "ORDER_STATE_CONFLICT", ex.getMessage());
    }

    @ExceptionHandler(ExternalServiceException.class)
    public ResponseEntity<Map<String, Object>> handleExternalService(ExternalServiceException ex) {
        log.error("External service failure: {} - {}", ex.getServiceName(), ex.getMessage());
        return error(HttpStatus.BAD_GATEWAY, "SERVICE_ERROR", RETRY_MESSAGE);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", RETRY_MESSAGE);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status)
                .body(Map.of(
                        "error", code,
                        "message", message != null ? message : status.getReasonPhrase(),
                        "timestamp", Instant.now().toString()
                ));
    }
}
