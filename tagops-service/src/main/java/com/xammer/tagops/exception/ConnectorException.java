package com.xammer.tagops.exception;

import org.springframework.http.HttpStatus;

/**
 * A cloud provider call failed or reported failure.
 */
public class ConnectorException extends TagOpsException {

    public ConnectorException(String message) {
        super(message);
    }

    public ConnectorException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.BAD_GATEWAY;
    }
}
