package com.iptv.gateway.core.proxy;

import java.util.Locale;
import java.util.OptionalLong;

/**
 * Outbound header decisions for a proxied response.
 *
 * <p>The content type is taken from the upstream, else inferred from the requested path.
 * {@code Content-Length} is forwarded only when the upstream sent one without a
 * {@code Transfer-Encoding}; otherwise the response is sent chunked.
 */
public record ProxyHeaders(
        String contentType,
        OptionalLong contentLength
) {

    static final String MPEG_TS = "video/MP2T";
    static final String HLS_PLAYLIST = "application/vnd.apple.mpegurl";
    static final String OCTET_STREAM = "application/octet-stream";

    public static ProxyHeaders forStream(UpstreamMedia upstream, String requestedUrl) {
        String contentType = isBlank(upstream.getContentType())
                ? inferContentType(requestedUrl)
                : upstream.getContentType();
        return new ProxyHeaders(contentType, forwardedLength(upstream));
    }

    public static ProxyHeaders forImage(UpstreamMedia upstream) {
        return new ProxyHeaders(upstream.getContentType(), forwardedLength(upstream));
    }

    public boolean chunked() {
        return contentLength.isEmpty();
    }

    static String inferContentType(String requestedUrl) {
        String path = requestedUrl.toLowerCase(Locale.ROOT);
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        if (path.endsWith(".ts")) {
            return MPEG_TS;
        }
        if (path.endsWith(".m3u8")) {
            return HLS_PLAYLIST;
        }
        return OCTET_STREAM;
    }

    private static OptionalLong forwardedLength(UpstreamMedia upstream) {
        if (isBlank(upstream.getContentLength()) || !isBlank(upstream.getTransferEncoding())) {
            return OptionalLong.empty();
        }
        try {
            long length = Long.parseLong(upstream.getContentLength().trim());
            return length >= 0 ? OptionalLong.of(length) : OptionalLong.empty();
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
