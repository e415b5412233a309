package com.iptv.gateway.core.proxy;

/**
 * How a proxied stream ended.
 */
public enum TerminalStatus {

    /** Upstream body fully copied. */
    COMPLETED,

    /** Upstream transport failed mid-stream; the bytes already sent stand as the response. */
    UPSTREAM_CLOSED,

    /** The caller stopped reading. */
    DOWNSTREAM_CLOSED,

    /** Unexpected failure while copying. */
    ERROR
}
