package com.prudhvi.event_stream.stream;

import com.prudhvi.event_stream.auth.AuthorizationException;
import com.prudhvi.event_stream.auth.PermissionServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Translates stream-opening failures into clean HTTP responses so callers get a status code
 * instead of a 500 stack trace. None of these ever reach an already-open stream.
 */
@RestControllerAdvice
public class StreamExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(StreamExceptionHandler.class);

    @ExceptionHandler(AuthorizationException.class)
    public ResponseEntity<Map<String, String>> handleUnauthorized(AuthorizationException ex) {
        return error(HttpStatus.FORBIDDEN, ex.getMessage());
    }

    @ExceptionHandler(TooManyConnectionsException.class)
    public ResponseEntity<Map<String, String>> handleTooMany(TooManyConnectionsException ex) {
        return error(HttpStatus.TOO_MANY_REQUESTS, ex.getMessage());
    }

    @ExceptionHandler(PermissionServiceException.class)
    public ResponseEntity<Map<String, String>> handleUnavailable(PermissionServiceException ex) {
        log.warn("Rejecting stream, permission service unavailable: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Permission service unavailable");
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, String>> handleRegistryDown(DataAccessException ex) {
        log.warn("Rejecting stream, connection registry unavailable: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Connection registry unavailable");
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception ex) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .body(Map.of("error", message == null ? status.getReasonPhrase() : message));
    }
}
