package com.iptv.gateway.core.exception;

/**
 * Domain exception thrown when a mandatory catalog endpoint does not return a list.
 */
public class InvalidCatalogFormatException extends RuntimeException {

    public InvalidCatalogFormatException(String message) {
        super(message);
    }
}
