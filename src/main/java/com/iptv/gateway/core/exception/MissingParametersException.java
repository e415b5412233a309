package com.iptv.gateway.core.exception;

/**
 * Domain exception thrown when a request lacks the upstream URL or credentials.
 */
public class MissingParametersException extends RuntimeException {

    public MissingParametersException(String message) {
        super(message);
    }
}
