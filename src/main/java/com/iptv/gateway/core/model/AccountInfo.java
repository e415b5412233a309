package com.iptv.gateway.core.model;

/**
 * Result of a successful credential check: the account as echoed by the upstream
 * and the base URL of the media server that serves its streams.
 */
public record AccountInfo(
        String username,
        String password,
        String serverUrl
) {}
