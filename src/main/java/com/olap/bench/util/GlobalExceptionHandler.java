package com.olap.bench.util;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import com.olap.bench.domain.DimensionValueNotFoundException;
import com.olap.bench.domain.UnknownQuerySetException;
import com.olap.bench.repository.EngineCallException;
import com.olap.bench.repository.EngineUnavailableException;

import lombok.extern.slf4j.Slf4j;

/**
 * Maps exceptions escaping the REST controllers to JSON error bodies.
 *
 * Error response format:
 * <pre>
 * {
 *   "timestamp": "2026-03-02T10:30:00Z",
 *   "status": 404,
 *   "error": "Not Found",
 *   "message": "Unknown query set: 9.9",
 *   "path": "/api/query/9.9",
 *   "correlationId": "550e8400-e29b-41d4-a716-446655440000"
 * }
 * </pre>
 *
 * Statement failures inside a run never reach this handler; they are
 * counted in the run's result. Only failures that abort a request do.
 *
 * @see CorrelationIdFilter
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * HTTP 404 for a query set or grouped family name that is not in the catalog.
     */
    @ExceptionHandler(UnknownQuerySetException.class)
    public ResponseEntity<Map<String, Object>> handleUnknownQuerySet(
            UnknownQuerySetException ex,
            HttpServletRequest request) {

        log.warn("Unknown query set requested: {}", ex.getQueryName());

        Map<String, Object> body = createErrorBody(
            HttpStatus.NOT_FOUND,
            ex.getMessage(),
            request.getRequestURI()
        );

        return new ResponseEntity<>(body, HttpStatus.NOT_FOUND);
    }

    /**
     * HTTP 404 for a dimension value missing from the encoder tables.
     */
    @ExceptionHandler(DimensionValueNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleDimensionValueNotFound(
            DimensionValueNotFoundException ex,
            HttpServletRequest request) {

        log.warn("Dimension value not found: {} {}", ex.getDimension(), ex.getValue());

        Map<String, Object> body = createErrorBody(
            HttpStatus.NOT_FOUND,
            ex.getMessage(),
            request.getRequestURI()
        );

        return new ResponseEntity<>(body, HttpStatus.NOT_FOUND);
    }

    /**
     * HTTP 503 when the engine could not be reached at all, e.g. while
     * counting records before a run.
     */
    @ExceptionHandler(EngineUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleEngineUnavailable(
            EngineUnavailableException ex,
            HttpServletRequest request) {

        log.error("Engine unavailable: {}", ex.getMessage());

        Map<String, Object> body = createErrorBody(
            HttpStatus.SERVICE_UNAVAILABLE,
            ex.getMessage(),
            request.getRequestURI()
        );

        return new ResponseEntity<>(body, HttpStatus.SERVICE_UNAVAILABLE);
    }

    /**
     * HTTP 502 for an engine error that aborted the request.
     */
    @ExceptionHandler(EngineCallException.class)
    public ResponseEntity<Map<String, Object>> handleEngineCall(
            EngineCallException ex,
            HttpServletRequest request) {

        log.error("Engine call failed: {}", ex.getMessage());

        Map<String, Object> body = createErrorBody(
            HttpStatus.BAD_GATEWAY,
            ex.getMessage(),
            request.getRequestURI()
        );

        return new ResponseEntity<>(body, HttpStatus.BAD_GATEWAY);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex,
            HttpServletRequest request) {

        log.warn("Parameter type mismatch: {}", ex.getMessage());

        Map<String, Object> body = createErrorBody(
            HttpStatus.BAD_REQUEST,
            "Invalid value for parameter '" + ex.getName() + "': " + ex.getValue(),
            request.getRequestURI()
        );

        return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
    }

    /**
     * HTTP 400 for invalid run parameters, e.g. concurrency or batch size below 1.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgumentException(
            IllegalArgumentException ex,
            HttpServletRequest request) {

        log.warn("Illegal argument: {}", ex.getMessage());

        Map<String, Object> body = createErrorBody(
            HttpStatus.BAD_REQUEST,
            ex.getMessage(),
            request.getRequestURI()
        );

        return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(
            Exception ex,
            HttpServletRequest request) {

        log.error("Unhandled exception", ex);

        Map<String, Object> body = createErrorBody(
            HttpStatus.INTERNAL_SERVER_ERROR,
            "An unexpected error occurred. Please report the correlation ID.",
            request.getRequestURI()
        );

        return new ResponseEntity<>(body, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private Map<String, Object> createErrorBody(HttpStatus status, String message, String path) {
        Map<String, Object> body = new HashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("message", message);
        body.put("path", path);
        body.put("correlationId", CorrelationIdFilter.getCurrentCorrelationId());

        return body;
    }
}
