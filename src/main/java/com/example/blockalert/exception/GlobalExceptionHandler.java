package com.example.blockalert.exception;

import com.example.blockalert.config.CorrelationIdFilter;
import com.example.blockalert.dto.ErrorResponse;
import com.example.blockalert.dto.PartialFailureResponse;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

import java.time.ZonedDateTime;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(ValidationException ex, ServerWebExchange exchange) {
        log.warn("Validation error: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Validation Failed", ex.getMessage(), exchange);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleBindException(WebExchangeBindException ex, ServerWebExchange exchange) {
        String errors = ex.getBindingResult().getAllErrors().stream()
                .map(error -> error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Validation error: {}", errors);
        return error(HttpStatus.BAD_REQUEST, "Validation Failed", errors, exchange);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleInputException(ServerWebInputException ex, ServerWebExchange exchange) {
        log.warn("Bad request on {}: {}", exchange.getRequest().getPath(), ex.getReason());
        return error(HttpStatus.BAD_REQUEST, "Bad Request", ex.getReason(), exchange);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResourceNotFoundException ex, ServerWebExchange exchange) {
        log.warn("Not found: {}", ex.getMessage());
        return error(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), exchange);
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ErrorResponse> handleRateLimit(RateLimitExceededException ex, ServerWebExchange exchange) {
        log.info("Limit reached: {} (limit {})", ex.getMessage(), ex.getLimit());
        return error(HttpStatus.TOO_MANY_REQUESTS, "Too Many Requests", ex.getMessage(), exchange);
    }

    @ExceptionHandler(RequestNotPermitted.class)
    public ResponseEntity<ErrorResponse> handleRequestNotPermitted(RequestNotPermitted ex, ServerWebExchange exchange) {
        log.warn("Request rate limit hit on {}: {}", exchange.getRequest().getPath(), ex.getMessage());
        return error(HttpStatus.TOO_MANY_REQUESTS, "Too Many Requests", "Too many requests. Please try again later.", exchange);
    }

    @ExceptionHandler(PartialFailureException.class)
    public ResponseEntity<PartialFailureResponse> handlePartialFailure(PartialFailureException ex, ServerWebExchange exchange) {
        PartialFailureResponse body = new PartialFailureResponse(
                ZonedDateTime.now(),
                HttpStatus.MULTI_STATUS.value(),
                ex.getMessage(),
                ex.getSucceeded(),
                ex.getFailedReceivers(),
                exchange.getRequest().getPath().toString());
        return new ResponseEntity<>(body, HttpStatus.MULTI_STATUS);
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(ConflictException ex, ServerWebExchange exchange) {
        log.warn("Conflict: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, "Conflict", ex.getMessage(), exchange);
    }

    @ExceptionHandler(NetworkUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleNetworkUnavailable(NetworkUnavailableException ex, ServerWebExchange exchange) {
        log.warn("Network unavailable: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable", ex.getMessage(), exchange);
    }

    @ExceptionHandler(PersistenceException.class)
    public ResponseEntity<ErrorResponse> handlePersistence(PersistenceException ex, ServerWebExchange exchange) {
        log.error("Persistence failure at {}: {}", exchange.getRequest().getPath(), ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Persistence Error", ex.getMessage(), exchange);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(DataAccessException ex, ServerWebExchange exchange) {
        log.error("Data access failure at {}", exchange.getRequest().getPath(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Persistence Error", "The alert store could not complete the request.", exchange);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatusException(ResponseStatusException ex, ServerWebExchange exchange) {
        if (ex.getStatusCode().is5xxServerError()) {
            log.error("Server error on path {}", exchange.getRequest().getPath(), ex);
        } else {
            log.warn("Client error {} on path '{}': {}", ex.getStatusCode().value(), exchange.getRequest().getPath(), ex.getReason());
        }
        ErrorResponse body = new ErrorResponse(
                ZonedDateTime.now(),
                ex.getStatusCode().value(),
                ex.getStatusCode().toString(),
                ex.getReason(),
                exchange.getRequest().getPath().toString(),
                correlationId(exchange));
        return new ResponseEntity<>(body, ex.getStatusCode());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, ServerWebExchange exchange) {
        log.error("Unexpected error at path {}", exchange.getRequest().getPath(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please try again later.", exchange);
    }

    private ResponseEntity<ErrorResponse> error(HttpStatus status, String error, String message, ServerWebExchange exchange) {
        ErrorResponse body = new ErrorResponse(
                ZonedDateTime.now(),
                status.value(),
                error,
                message,
                exchange.getRequest().getPath().toString(),
                correlationId(exchange));
        return new ResponseEntity<>(body, status);
    }

    private String correlationId(ServerWebExchange exchange) {
        Object value = exchange.getAttribute(CorrelationIdFilter.CORRELATION_ID_KEY);
        return value != null ? value.toString() : null;
    }
}
