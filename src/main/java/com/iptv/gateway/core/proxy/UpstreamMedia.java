package com.iptv.gateway.core.proxy;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * An open upstream response whose body has not been consumed yet.
 * Closing it releases the upstream connection.
 */
public class UpstreamMedia implements Closeable {

    private final int statusCode;
    private final String contentType;
    private final String contentLength;
    private final String transferEncoding;
    private final InputStream body;
    private final Closeable handle;

    public UpstreamMedia(int statusCode, String contentType, String contentLength, String transferEncoding,
                         InputStream body, Closeable handle) {
        this.statusCode = statusCode;
        this.contentType = contentType;
        this.contentLength = contentLength;
        this.transferEncoding = transferEncoding;
        this.body = Objects.requireNonNull(body, "body must not be null");
        this.handle = Objects.requireNonNull(handle, "handle must not be null");
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    public String getContentType() {
        return contentType;
    }

    public String getContentLength() {
        return contentLength;
    }

    public String getTransferEncoding() {
        return transferEncoding;
    }

    public InputStream getBody() {
        return body;
    }

    @Override
    public void close() throws IOException {
        handle.close();
    }
}
