package com.iptv.gateway.core.proxy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Copies an upstream body to the caller in fixed-size chunks, flushing after each chunk so
 * nothing beyond one chunk is held in memory.
 *
 * <p>Once copying has started the response headers are committed, so no failure may escape:
 * every outcome is reported as a {@link StreamCopyResult}. The upstream is closed on every path.
 */
public class StreamPump {

    private static final Logger log = LoggerFactory.getLogger(StreamPump.class);

    public static final int DEFAULT_CHUNK_SIZE = 8192;

    private final int chunkSize;

    public StreamPump(int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        this.chunkSize = chunkSize;
    }

    public StreamCopyResult copy(UpstreamMedia upstream, OutputStream out) {
        StreamCopyResult result;
        try {
            result = pump(upstream.getBody(), out);
        } finally {
            closeQuietly(upstream);
        }
        report(result);
        return result;
    }

    private StreamCopyResult pump(InputStream in, OutputStream out) {
        byte[] buffer = new byte[chunkSize];
        long copied = 0;
        while (true) {
            int read;
            try {
                read = in.read(buffer);
            } catch (IOException e) {
                return new StreamCopyResult(copied, TerminalStatus.UPSTREAM_CLOSED, e);
            } catch (RuntimeException e) {
                return new StreamCopyResult(copied, TerminalStatus.ERROR, e);
            }
            if (read < 0) {
                return new StreamCopyResult(copied, TerminalStatus.COMPLETED, null);
            }
            if (read == 0) {
                continue;
            }
            try {
                out.write(buffer, 0, read);
                out.flush();
            } catch (IOException e) {
                return new StreamCopyResult(copied, TerminalStatus.DOWNSTREAM_CLOSED, e);
            } catch (RuntimeException e) {
                return new StreamCopyResult(copied, TerminalStatus.ERROR, e);
            }
            copied += read;
        }
    }

    private void report(StreamCopyResult result) {
        switch (result.status()) {
            case COMPLETED -> log.info("Stream completed, sent {} bytes", result.bytesCopied());
            case UPSTREAM_CLOSED -> log.warn("Upstream closed after {} bytes: {}",
                    result.bytesCopied(), result.failure().toString());
            case DOWNSTREAM_CLOSED -> log.info("Client disconnected after {} bytes", result.bytesCopied());
            case ERROR -> log.error("Streaming error after {} bytes", result.bytesCopied(), result.failure());
        }
    }

    private void closeQuietly(UpstreamMedia upstream) {
        try {
            upstream.close();
        } catch (IOException | RuntimeException e) {
            log.debug("Failed to release upstream response", e);
        }
    }
}
