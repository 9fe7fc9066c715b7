package com.employeedb.exception;

import com.employeedb.dto.ApiResponses;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.HttpMediaTypeException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.HashMap;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Centralized exception mapper for all REST endpoints.
 *
 * EXCEPTION → HTTP STATUS MAPPING:
 *
 * Exception Type                       | HTTP Status | When
 * -------------------------------------|-------------|-----------------------------------------
 * MethodArgumentNotValidException      | 400         | Bean Validation failure on request body
 * HttpMessageNotReadableException      | 400         | Body missing or not valid JSON
 * MethodArgumentTypeMismatchException  | 400         | Non-numeric employee id
 * HandlerMethodValidationException     | 400         | Non-positive employee id
 * IllegalArgumentException             | 400         | Domain guard (blank name)
 * NoSuchElementException               | 404         | Employee not found
 * NoResourceFoundException             | 404         | Unknown path
 * HttpRequestMethodNotSupportedException | 405       | Wrong verb on a known path
 * HttpMediaTypeException               | 415 / 406   | Unsupported Content-Type or Accept
 * ServletRequestBindingException       | 400         | Missing header / parameter
 * ErrorResponseException               | its status  | Other Spring MVC client errors
 * DataAccessException                  | 503         | Database unreachable or query failed
 * CannotCreateTransactionException     | 503         | No connection available for a transaction
 * Exception (fallback)                 | 500         | Unexpected system errors
 *
 * No stack traces in responses. Database failures are not retried here.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    // ─────────────────────────────────────────────────────────────────────────
    // 400 BAD REQUEST - Invalid input
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Returns a field → message map for @Valid failures on request DTOs.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String field = ((FieldError) error).getField();
            errors.put(field, error.getDefaultMessage());
        });
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        return badRequest("Request body is missing or malformed");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return badRequest("Invalid value for '" + ex.getName() + "': " + ex.getValue());
    }

    @ExceptionHandler({HandlerMethodValidationException.class, ConstraintViolationException.class})
    public ResponseEntity<ApiResponses.ErrorResponse> handleParameterValidation(Exception ex) {
        return badRequest("Employee id must be a positive integer");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        return badRequest(ex.getMessage());
    }

    // ─────────────────────────────────────────────────────────────────────────
    // 404 NOT FOUND / 405 METHOD NOT ALLOWED
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Handles EmployeeNotFoundException, which services throw when
     * findById() comes back empty.
     */
    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleNotFound(NoSuchElementException ex) {
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(new ApiResponses.ErrorResponse("NOT_FOUND", ex.getMessage()));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleNoResource(NoResourceFoundException ex) {
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(new ApiResponses.ErrorResponse("NOT_FOUND", "No endpoint at /" + ex.getResourcePath()));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        return ResponseEntity
                .status(HttpStatus.METHOD_NOT_ALLOWED)
                .body(new ApiResponses.ErrorResponse("METHOD_NOT_ALLOWED", ex.getMessage()));
    }

    /**
     * Spring MVC's own request errors carry their status (415, 406, 400, ...).
     */
    @ExceptionHandler({HttpMediaTypeException.class,
                       ServletRequestBindingException.class,
                       ErrorResponseException.class})
    public ResponseEntity<ApiResponses.ErrorResponse> handleFrameworkClientError(Exception ex) {
        return fromErrorResponse((ErrorResponse) ex, ex.getMessage());
    }

    // ─────────────────────────────────────────────────────────────────────────
    // 503 SERVICE UNAVAILABLE - Database failure at request time
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Database errors during a request are surfaced immediately; only the
     * startup loop retries.
     */
    @ExceptionHandler({DataAccessException.class, CannotCreateTransactionException.class})
    public ResponseEntity<ApiResponses.ErrorResponse> handleDatabaseFailure(RuntimeException ex) {
        log.error("Database failure while handling request: {}", ex.getMessage(), ex);
        return ResponseEntity
                .status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ApiResponses.ErrorResponse(
                        "SERVICE_UNAVAILABLE",
                        "Database is unavailable. Check /health."
                ));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // 500 INTERNAL SERVER ERROR - Unexpected failures
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Safety net for any unhandled exception.
     * Message is deliberately generic; internal detail must not leak to clients.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleGeneric(Exception ex) {
        if (ex instanceof ErrorResponse && ((ErrorResponse) ex).getStatusCode().is4xxClientError()) {
            return fromErrorResponse((ErrorResponse) ex, ex.getMessage());
        }
        log.error("Unhandled exception", ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiResponses.ErrorResponse(
                        "INTERNAL_SERVER_ERROR",
                        "An unexpected error occurred."
                ));
    }

    private ResponseEntity<ApiResponses.ErrorResponse> fromErrorResponse(ErrorResponse errorResponse,
                                                                         String message) {
        HttpStatusCode statusCode = errorResponse.getStatusCode();
        HttpStatus status = HttpStatus.resolve(statusCode.value());
        String error = status != null ? status.name() : String.valueOf(statusCode.value());
        return ResponseEntity
                .status(statusCode)
                .body(new ApiResponses.ErrorResponse(error, message));
    }

    private ResponseEntity<ApiResponses.ErrorResponse> badRequest(String message) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ApiResponses.ErrorResponse("BAD_REQUEST", message));
    }
}
