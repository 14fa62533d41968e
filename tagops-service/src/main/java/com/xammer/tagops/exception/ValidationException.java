package com.xammer.tagops.exception;

import org.springframework.http.HttpStatus;

/**
 * Malformed caller input. Never retried.
 */
public class ValidationException extends TagOpsException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.BAD_REQUEST;
    }
}
