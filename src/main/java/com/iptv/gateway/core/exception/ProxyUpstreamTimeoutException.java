package com.iptv.gateway.core.exception;

/**
 * Thrown when a proxied upstream does not answer in time, before any bytes were sent.
 */
public class ProxyUpstreamTimeoutException extends RuntimeException {

    public ProxyUpstreamTimeoutException(String message) {
        super(message);
    }

    public ProxyUpstreamTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
