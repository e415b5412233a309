package com.iptv.gateway.core.exception;

/**
 * Domain exception thrown when the account check reply cannot be understood.
 */
public class AuthResponseMalformedException extends RuntimeException {

    public AuthResponseMalformedException(String message) {
        super(message);
    }
}
