package com.example.consult.shared.exception;

import com.example.consult.shared.dto.ErrorResponse;
import com.example.consult.shared.util.Constants.SessionState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(UnauthenticatedException.class)
    public ResponseEntity<ErrorResponse> handleUnauthenticated(UnauthenticatedException ex, ServerWebExchange exchange) {
        log.warn("Unauthenticated request on path '{}': {}", exchange.getRequest().getPath(), ex.getMessage());
        return build(HttpStatus.UNAUTHORIZED, "Unauthorized", ex.getMessage(), exchange, null);
    }

    @ExceptionHandler(ForbiddenException.class)
    public ResponseEntity<ErrorResponse> handleForbidden(ForbiddenException ex, ServerWebExchange exchange) {
        log.warn("Forbidden request for room {} on path '{}': {}", ex.getRoomId(), exchange.getRequest().getPath(), ex.getMessage());
        return build(HttpStatus.FORBIDDEN, "Forbidden", ex.getMessage(), exchange, null);
    }

    @ExceptionHandler(SessionConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(SessionConflictException ex, ServerWebExchange exchange) {
        log.warn("Session conflict for room {}: {} (state: {})", ex.getRoomId(), ex.getMessage(), ex.getState());
        return build(HttpStatus.CONFLICT, "Conflict", ex.getMessage(), exchange, ex.getState());
    }

    @ExceptionHandler(SessionClosedException.class)
    public ResponseEntity<ErrorResponse> handleSessionClosed(SessionClosedException ex, ServerWebExchange exchange) {
        log.info("Rejected request for closed room {} (state: {})", ex.getRoomId(), ex.getState());
        return build(HttpStatus.CONFLICT, "Session Closed", ex.getMessage(), exchange, ex.getState().name());
    }

    @ExceptionHandler(NotYetStartedException.class)
    public ResponseEntity<ErrorResponse> handleNotYetStarted(NotYetStartedException ex, ServerWebExchange exchange) {
        log.info("Rejected join for room {} that has not started yet", ex.getRoomId());
        return build(HttpStatus.TOO_EARLY, "Not Yet Started", ex.getMessage(), exchange, SessionState.SCHEDULED.name());
    }

    @ExceptionHandler(RelayRefusedException.class)
    public ResponseEntity<ErrorResponse> handleRelayRefused(RelayRefusedException ex, ServerWebExchange exchange) {
        log.warn("Relay refused {} connection for room {}: {} (state: {})", ex.getRole(), ex.getRoomId(), ex.getMessage(), ex.getState());
        return build(HttpStatus.CONFLICT, "Relay Refused", ex.getMessage(), exchange, ex.getState());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(WebExchangeBindException ex, ServerWebExchange exchange) {
        String errors = ex.getBindingResult()
                .getAllErrors().stream()
                .map(error -> error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Validation error: {}", errors);
        return build(HttpStatus.BAD_REQUEST, "Validation Failed", errors, exchange, null);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatusException(ResponseStatusException ex, ServerWebExchange exchange) {
        ErrorResponse errorResponse = new ErrorResponse(
                OffsetDateTime.now(ZoneOffset.UTC),
                ex.getStatusCode().value(),
                ex.getStatusCode().toString(),
                ex.getReason(),
                exchange.getRequest().getPath().toString()
        );

        if (ex.getStatusCode().is4xxClientError()) {
            log.warn("Client error: {} on path '{}' - Reason: {}", ex.getStatusCode().value(), exchange.getRequest().getPath(), ex.getReason());
        }
        else if (ex.getStatusCode().is5xxServerError()) {
            log.error("Server error occurred on path {}:", exchange.getRequest().getPath(), ex);
        }

        return new ResponseEntity<>(errorResponse, ex.getStatusCode());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, ServerWebExchange exchange) {
        log.error("An unexpected error occurred at path {}:", exchange.getRequest().getPath(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please try again later.", exchange, null);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String error, String message, ServerWebExchange exchange, String state) {
        ErrorResponse errorResponse = new ErrorResponse(
                OffsetDateTime.now(ZoneOffset.UTC),
                status.value(),
                error,
                message,
                exchange.getRequest().getPath().toString(),
                state
        );
        return new ResponseEntity<>(errorResponse, status);
    }
}
