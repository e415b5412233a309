package com.iptv.gateway.application.service;

import com.iptv.gateway.config.GatewayProperties;
import com.iptv.gateway.core.model.XtreamCredentials;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GuideServiceTest {

    private static final XtreamCredentials CREDENTIALS = new XtreamCredentials("http://panel", "user", "pass");
    private static final String GUIDE = "<tv><icon src=\"http://img/a.png\"/></tv>";

    @Test
    @DisplayName("Validates the account, then rewrites icons through the proxy")
    void rewritesIcons() {
        FakeXtreamApi api = new FakeXtreamApi().guide(GUIDE);

        String guide = new GuideService(api, new GatewayProperties()).generate(CREDENTIALS, "http://gw", true);

        assertThat(api.calls).containsExactly("authenticate", "xmltv");
        assertThat(guide).isEqualTo("<tv><icon src=\"http://gw/image-proxy/http%3A%2F%2Fimg%2Fa.png\"/></tv>");
    }

    @Test
    @DisplayName("Leaves the guide untouched when proxying is off")
    void keepsGuideWithoutProxy() {
        FakeXtreamApi api = new FakeXtreamApi().guide(GUIDE);

        assertThat(new GuideService(api, new GatewayProperties()).generate(CREDENTIALS, "http://gw", false))
                .isEqualTo(GUIDE);
    }
}
