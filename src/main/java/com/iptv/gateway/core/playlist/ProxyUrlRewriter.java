package com.iptv.gateway.core.playlist;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Routes upstream image and media URLs through this gateway's pass-through endpoints.
 * The original URL becomes a single percent-encoded path segment.
 */
public class ProxyUrlRewriter {

    public static final String IMAGE_PROXY_PATH = "/image-proxy/";
    public static final String STREAM_PROXY_PATH = "/stream-proxy/";

    private final String proxyBaseUrl;

    public ProxyUrlRewriter(String proxyBaseUrl) {
        String base = proxyBaseUrl == null ? "" : proxyBaseUrl;
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        this.proxyBaseUrl = base;
    }

    public String imageUrl(String originalUrl) {
        return proxyBaseUrl + IMAGE_PROXY_PATH + encode(originalUrl);
    }

    public String streamUrl(String originalUrl) {
        return proxyBaseUrl + STREAM_PROXY_PATH + encode(originalUrl);
    }

    /**
     * Percent-encodes everything except unreserved characters, so slashes and colons are encoded too.
     */
    public static String encode(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("*", "%2A")
                .replace("%7E", "~");
    }
}
