package com.iptv.gateway.application.service;

import com.iptv.gateway.application.port.MediaUpstreamPort;
import com.iptv.gateway.config.GatewayProperties;
import com.iptv.gateway.core.exception.ProxyUnsupportedContentTypeException;
import com.iptv.gateway.core.exception.ProxyUpstreamHttpException;
import com.iptv.gateway.core.proxy.ProxyHeaders;
import com.iptv.gateway.core.proxy.StreamCopyResult;
import com.iptv.gateway.core.proxy.StreamPump;
import com.iptv.gateway.core.proxy.UpstreamMedia;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.OutputStream;
import java.time.Duration;
import java.util.Locale;

/**
 * Pass-through proxy for media streams and images.
 *
 * <p>Opening happens before the response starts, so its failures become HTTP errors.
 * Transferring happens after, so it never throws; see {@link StreamPump}.
 */
@Service
public class MediaProxyService {

    private static final Logger log = LoggerFactory.getLogger(MediaProxyService.class);

    private final MediaUpstreamPort mediaUpstreamPort;
    private final StreamPump pump;
    private final Duration streamReadTimeout;
    private final Duration imageTimeout;

    public MediaProxyService(MediaUpstreamPort mediaUpstreamPort, GatewayProperties properties) {
        this.mediaUpstreamPort = mediaUpstreamPort;
        this.pump = new StreamPump(properties.getProxy().getChunkSize());
        this.streamReadTimeout = properties.getProxy().getStreamReadTimeout();
        this.imageTimeout = properties.getProxy().getImageTimeout();
    }

    /**
     * An opened upstream and the headers to send for it.
     */
    public record ProxiedMedia(
            UpstreamMedia upstream,
            ProxyHeaders headers
    ) {}

    public ProxiedMedia openStream(String url) {
        log.info("Stream proxy request for: {}", url);
        UpstreamMedia upstream = mediaUpstreamPort.open(url, streamReadTimeout);
        try {
            requireSuccess(upstream, url);
            ProxyHeaders headers = ProxyHeaders.forStream(upstream, url);
            log.debug("Using content type: {}", headers.contentType());
            return new ProxiedMedia(upstream, headers);
        } catch (RuntimeException e) {
            release(upstream);
            throw e;
        }
    }

    public ProxiedMedia openImage(String url) {
        log.info("Image proxy request for: {}", url);
        UpstreamMedia upstream = mediaUpstreamPort.open(url, imageTimeout);
        try {
            requireSuccess(upstream, url);
            String contentType = upstream.getContentType();
            if (contentType == null || !contentType.toLowerCase(Locale.ROOT).startsWith("image/")) {
                throw new ProxyUnsupportedContentTypeException("Invalid content type for image: " + contentType);
            }
            return new ProxiedMedia(upstream, ProxyHeaders.forImage(upstream));
        } catch (RuntimeException e) {
            release(upstream);
            throw e;
        }
    }

    /**
     * Copies the opened upstream to the caller and releases it. Never throws.
     */
    public StreamCopyResult transfer(ProxiedMedia media, OutputStream out) {
        return pump.copy(media.upstream(), out);
    }

    private static void requireSuccess(UpstreamMedia upstream, String url) {
        if (!upstream.isSuccessful()) {
            log.warn("HTTP error fetching {}: {}", url, upstream.getStatusCode());
            throw new ProxyUpstreamHttpException(upstream.getStatusCode(), url);
        }
    }

    private static void release(UpstreamMedia upstream) {
        try {
            upstream.close();
        } catch (IOException e) {
            log.debug("Failed to release upstream response", e);
        }
    }
}
