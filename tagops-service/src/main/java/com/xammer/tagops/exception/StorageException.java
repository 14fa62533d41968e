package com.xammer.tagops.exception;

import org.springframework.http.HttpStatus;

/**
 * The backing store could not complete the operation.
 */
public class StorageException extends TagOpsException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.SERVICE_UNAVAILABLE;
    }
}
