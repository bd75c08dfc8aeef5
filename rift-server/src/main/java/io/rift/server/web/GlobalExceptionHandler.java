package io.rift.server.web;

import io.rift.EventStoreException;
import io.rift.InvalidEventException;
import io.rift.PoolExhaustedException;
import io.rift.RuleNotFoundException;
import io.rift.server.api.ErrorResponse;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.TransactionException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.sql.SQLTransientConnectionException;
import java.util.stream.Collectors;

/**
 * Maps failures to {@link ErrorResponse} bodies. Validation problems answer 422,
 * store problems 500. By the time a store error reaches here the transaction
 * has already rolled back.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(RuleNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleRuleNotFound(RuleNotFoundException ex) {
        log.warn("Rejected event: {}", ex.getMessage());
        return unprocessable(ErrorResponse.RULE_NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(InvalidEventException.class)
    public ResponseEntity<ErrorResponse> handleInvalidEvent(InvalidEventException ex) {
        return unprocessable(ErrorResponse.VALIDATION_ERROR, ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(GlobalExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        return unprocessable(ErrorResponse.VALIDATION_ERROR, detail);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        return unprocessable(ErrorResponse.VALIDATION_ERROR, "Malformed request body");
    }

    @ExceptionHandler({ConstraintViolationException.class, HandlerMethodValidationException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleInvalidParameter(Exception ex) {
        return unprocessable(ErrorResponse.VALIDATION_ERROR, "Invalid request parameter");
    }

    @ExceptionHandler(PoolExhaustedException.class)
    public ResponseEntity<ErrorResponse> handlePoolExhausted(PoolExhaustedException ex) {
        log.error("Connection pool exhausted", ex);
        return serverError(ErrorResponse.POOL_EXHAUSTED, "Database connection pool exhausted");
    }

    @ExceptionHandler(EventStoreException.class)
    public ResponseEntity<ErrorResponse> handleStoreFailure(EventStoreException ex) {
        log.error("Event store failure", ex);
        return serverError(ErrorResponse.STORE_ERROR, "Failed to access event store");
    }

    /**
     * Spring raises these when the transaction cannot start, e.g. the pool
     * timed out before {@code @Transactional} got its connection.
     */
    @ExceptionHandler({TransactionException.class, DataAccessException.class})
    public ResponseEntity<ErrorResponse> handleSpringDataFailure(RuntimeException ex) {
        if (causedByPoolTimeout(ex)) {
            log.error("Connection pool exhausted", ex);
            return serverError(ErrorResponse.POOL_EXHAUSTED, "Database connection pool exhausted");
        }
        log.error("Database failure", ex);
        return serverError(ErrorResponse.STORE_ERROR, "Failed to access event store");
    }

    private static boolean causedByPoolTimeout(Throwable ex) {
        for (Throwable t = ex; t != null; t = t.getCause()) {
            if (t instanceof SQLTransientConnectionException) {
                return true;
            }
        }
        return false;
    }

    private static String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }

    private static ResponseEntity<ErrorResponse> unprocessable(String code, String detail) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(ErrorResponse.of(code, detail));
    }

    private static ResponseEntity<ErrorResponse> serverError(String code, String detail) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.of(code, detail));
    }
}
