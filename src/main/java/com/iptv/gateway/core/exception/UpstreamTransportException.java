package com.iptv.gateway.core.exception;

/**
 * Domain exception thrown when the upstream API cannot be reached or answers with an HTTP error.
 */
public class UpstreamTransportException extends RuntimeException {

    public UpstreamTransportException(String message) {
        super(message);
    }

    public UpstreamTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
