package com.iptv.gateway.core.playlist;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class ProxyUrlRewriterTest {

    @Test
    @DisplayName("Encodes the whole URL into one path segment")
    void encodesReservedCharacters() {
        String encoded = ProxyUrlRewriter.encode("http://host:80/a b/c.ts?x=1&y=~z*");

        assertThat(encoded).isEqualTo("http%3A%2F%2Fhost%3A80%2Fa%20b%2Fc.ts%3Fx%3D1%26y%3D~z%2A");
        assertThat(encoded).doesNotContain("/", "+");
        assertThat(URLDecoder.decode(encoded, StandardCharsets.UTF_8)).isEqualTo("http://host:80/a b/c.ts?x=1&y=~z*");
    }

    @Test
    @DisplayName("Trailing slashes of the base URL are dropped")
    void stripsTrailingSlash() {
        ProxyUrlRewriter rewriter = new ProxyUrlRewriter("http://gw/");

        assertThat(rewriter.streamUrl("http://m/1.ts")).isEqualTo("http://gw/stream-proxy/http%3A%2F%2Fm%2F1.ts");
        assertThat(rewriter.imageUrl("http://m/1.png")).isEqualTo("http://gw/image-proxy/http%3A%2F%2Fm%2F1.png");
    }
}
