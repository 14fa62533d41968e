package com.xammer.tagops.exception;

import org.springframework.http.HttpStatus;

/**
 * The entity is not in the state the requested transition needs.
 */
public class InvalidStateException extends TagOpsException {

    public InvalidStateException(String message) {
        super(message);
    }

    public InvalidStateException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.CONFLICT;
    }
}
