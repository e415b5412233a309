package com.iptv.gateway.core.exception;

/**
 * Thrown for any other proxy failure before streaming started.
 */
public class ProxyFailureException extends RuntimeException {

    public ProxyFailureException(String message) {
        super(message);
    }

    public ProxyFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
