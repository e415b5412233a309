package com.iptv.gateway.config;

import com.iptv.gateway.core.proxy.StreamPump;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Typed gateway settings bound from {@code application.properties} (prefix {@code gateway}).
 */
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    /**
     * Base URL used for proxy rewriting when the request does not name one.
     * Blank means the request's own scheme, host and port.
     */
    private String defaultProxyUrl = "";

    private final Upstream upstream = new Upstream();
    private final Catalog catalog = new Catalog();
    private final Episodes episodes = new Episodes();
    private final Guide guide = new Guide();
    private final Proxy proxy = new Proxy();

    public String getDefaultProxyUrl() {
        return defaultProxyUrl;
    }

    public void setDefaultProxyUrl(String defaultProxyUrl) {
        this.defaultProxyUrl = defaultProxyUrl;
    }

    public Upstream getUpstream() {
        return upstream;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public Episodes getEpisodes() {
        return episodes;
    }

    public Guide getGuide() {
        return guide;
    }

    public Proxy getProxy() {
        return proxy;
    }

    public static class Upstream {

        private Duration connectTimeout = Duration.ofSeconds(10);
        private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
                + "(KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36";

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public String getUserAgent() {
            return userAgent;
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = userAgent;
        }
    }

    public static class Catalog {

        private int concurrency = 10;

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }
    }

    public static class Episodes {

        private int concurrency = 5;
        private Duration timeout = Duration.ofSeconds(20);

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Guide {

        private Duration timeout = Duration.ofSeconds(20);

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Proxy {

        private Duration streamReadTimeout = Duration.ofSeconds(60);
        private Duration imageTimeout = Duration.ofSeconds(10);
        private int chunkSize = StreamPump.DEFAULT_CHUNK_SIZE;
        private int maxConcurrentStreams = 256;

        public Duration getStreamReadTimeout() {
            return streamReadTimeout;
        }

        public void setStreamReadTimeout(Duration streamReadTimeout) {
            this.streamReadTimeout = streamReadTimeout;
        }

        public Duration getImageTimeout() {
            return imageTimeout;
        }

        public void setImageTimeout(Duration imageTimeout) {
            this.imageTimeout = imageTimeout;
        }

        public int getChunkSize() {
            return chunkSize;
        }

        public void setChunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
        }

        public int getMaxConcurrentStreams() {
            return maxConcurrentStreams;
        }

        public void setMaxConcurrentStreams(int maxConcurrentStreams) {
            this.maxConcurrentStreams = maxConcurrentStreams;
        }
    }
}
