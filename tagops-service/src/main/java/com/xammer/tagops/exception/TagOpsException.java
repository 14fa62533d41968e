package com.xammer.tagops.exception;

import org.springframework.http.HttpStatus;

/**
 * Base of the typed error hierarchy. Each subclass carries the HTTP status the API layer reports for it.
 */
public abstract class TagOpsException extends RuntimeException {

    protected TagOpsException(String message) {
        super(message);
    }

    protected TagOpsException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract HttpStatus getStatus();
}
