package com.iptv.gateway.infrastructure.upstream;

import com.iptv.gateway.core.exception.ProxyFailureException;
import com.iptv.gateway.core.exception.ProxyUpstreamTimeoutException;
import com.iptv.gateway.core.proxy.UpstreamMedia;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OkHttpMediaAdapterTest {

    private MockWebServer server;
    private OkHttpMediaAdapter adapter;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        adapter = new OkHttpMediaAdapter(new OkHttpClient());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    @DisplayName("Opens the upstream without reading its body")
    void opensUpstream() throws IOException {
        server.enqueue(new MockResponse().setHeader("Content-Type", "video/MP2T").setBody("abcdef"));

        try (UpstreamMedia media = adapter.open(server.url("/live/1.ts").toString(), Duration.ofSeconds(5))) {
            assertThat(media.getStatusCode()).isEqualTo(200);
            assertThat(media.getContentType()).isEqualTo("video/MP2T");
            assertThat(media.getContentLength()).isEqualTo("6");
            assertThat(media.getBody().readAllBytes()).isEqualTo("abcdef".getBytes());
        }
    }

    @Test
    @DisplayName("Error statuses are returned to the caller, not thrown")
    void returnsErrorStatus() throws IOException {
        server.enqueue(new MockResponse().setResponseCode(404));

        try (UpstreamMedia media = adapter.open(server.url("/missing").toString(), Duration.ofSeconds(5))) {
            assertThat(media.isSuccessful()).isFalse();
            assertThat(media.getStatusCode()).isEqualTo(404);
        }
    }

    @Test
    @DisplayName("A silent upstream times out")
    void timesOut() {
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));

        assertThatThrownBy(() -> adapter.open(server.url("/slow.ts").toString(), Duration.ofMillis(300)))
                .isInstanceOf(ProxyUpstreamTimeoutException.class);
    }

    @Test
    @DisplayName("An invalid URL is a proxy failure")
    void invalidUrl() {
        assertThatThrownBy(() -> adapter.open("not a url", Duration.ofSeconds(1)))
                .isInstanceOf(ProxyFailureException.class);
    }
}
