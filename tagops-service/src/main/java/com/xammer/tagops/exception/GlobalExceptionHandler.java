package com.xammer.tagops.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Date;
import java.util.HashMap;
import java.util.Map;

@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(TagOpsException.class)
    public ResponseEntity<Map<String, Object>> handleTagOpsException(TagOpsException ex) {
        HttpStatus status = ex.getStatus();
        if (status.is5xxServerError()) {
            logger.error("Request failed with {}: {}", status, ex.getMessage(), ex);
        } else {
            logger.debug("Request rejected with {}: {}", status, ex.getMessage());
        }
        return build(status, ex.getMessage());
    }

    /**
     * Bodies Jackson cannot read, including a {@link com.xammer.tagops.domain.TagRule} whose constructor
     * rejected it, are the caller's fault.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        Throwable cause = ex.getMostSpecificCause();
        if (cause instanceof ValidationException) {
            return build(HttpStatus.BAD_REQUEST, cause.getMessage());
        }
        return build(HttpStatus.BAD_REQUEST, "Malformed request body: " + cause.getMessage());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return build(HttpStatus.BAD_REQUEST, "Invalid value for parameter '" + ex.getName() + "': " + ex.getValue());
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, Object>> handleDataAccessException(DataAccessException ex) {
        logger.error("Backing store unavailable", ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Storage unavailable: " + ex.getMostSpecificCause().getMessage());
    }

    /**
     * Handles general, unexpected exceptions throughout the application.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> globalExceptionHandler(Exception ex) {
        logger.error("Unhandled exception", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred: " + ex.getMessage());
    }

    private ResponseEntity<Map<String, Object>> build(HttpStatus status, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("timestamp", new Date());
        body.put("error", status.getReasonPhrase());
        body.put("message", message);
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body);
    }
}
