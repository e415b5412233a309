package com.iptv.gateway.core.model;

import java.util.Objects;

/**
 * Upstream API location and account credentials supplied by the caller.
 */
public record XtreamCredentials(
        String baseUrl,
        String username,
        String password
) {

    public XtreamCredentials {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        Objects.requireNonNull(username, "username must not be null");
        Objects.requireNonNull(password, "password must not be null");
        while (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
    }

    @Override
    public String toString() {
        return "XtreamCredentials[baseUrl=" + baseUrl + ", username=" + username + "]";
    }
}
