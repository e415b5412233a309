package com.iptv.gateway.core.exception;

/**
 * Domain exception thrown when the upstream rejects the account or its reply lacks account data.
 */
public class InvalidCredentialsException extends RuntimeException {

    public InvalidCredentialsException(String message) {
        super(message);
    }
}
