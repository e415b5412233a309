package com.iptv.gateway.core.guide;

import com.iptv.gateway.core.playlist.ProxyUrlRewriter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GuideRewriterTest {

    private final GuideRewriter rewriter = new GuideRewriter(new ProxyUrlRewriter("http://gw:5000"));

    @Test
    @DisplayName("Icon sources are routed through the image proxy, everything else is untouched")
    void rewritesIconsOnly() {
        String guide = "<?xml version=\"1.0\"?>\n<tv>"
                + "<channel id=\"bbc.uk\"><display-name>BBC</display-name><icon src=\"http://img/bbc.png\"/></channel>"
                + "<programme channel=\"bbc.uk\"><title>News &amp; Weather</title></programme></tv>";

        String rewritten = rewriter.rewriteIcons(guide);

        assertThat(rewritten).isEqualTo("<?xml version=\"1.0\"?>\n<tv>"
                + "<channel id=\"bbc.uk\"><display-name>BBC</display-name>"
                + "<icon src=\"http://gw:5000/image-proxy/http%3A%2F%2Fimg%2Fbbc.png\"/></channel>"
                + "<programme channel=\"bbc.uk\"><title>News &amp; Weather</title></programme></tv>");
    }

    @Test
    @DisplayName("Escaped ampersands in icon URLs are unescaped before proxying")
    void unescapesAmpersands() {
        String rewritten = rewriter.rewriteIcons("<icon src=\"http://img/a.png?x=1&amp;y=2\" />");

        assertThat(rewritten).isEqualTo("<icon src=\"http://gw:5000/image-proxy/http%3A%2F%2Fimg%2Fa.png%3Fx%3D1%26y%3D2\" />");
    }

    @Test
    @DisplayName("A guide without icons comes back unchanged")
    void noIcons() {
        String guide = "<tv><channel id=\"x\"/></tv>";

        assertThat(rewriter.rewriteIcons(guide)).isEqualTo(guide);
    }
}
