package com.iptv.gateway.core.exception;

/**
 * Thrown when a proxied upstream answers with a non-2xx status. The status is forwarded to the caller.
 */
public class ProxyUpstreamHttpException extends RuntimeException {

    private final int statusCode;

    public ProxyUpstreamHttpException(int statusCode, String url) {
        super("Upstream answered " + statusCode + " for " + url);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
