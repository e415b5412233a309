package com.iptv.gateway.core.exception;

/**
 * Thrown when a proxied upstream answers with content of the wrong category.
 */
public class ProxyUnsupportedContentTypeException extends RuntimeException {

    public ProxyUnsupportedContentTypeException(String message) {
        super(message);
    }
}
