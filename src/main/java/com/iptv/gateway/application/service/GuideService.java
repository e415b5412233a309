package com.iptv.gateway.application.service;

import com.iptv.gateway.application.port.XtreamApiPort;
import com.iptv.gateway.config.GatewayProperties;
import com.iptv.gateway.core.guide.GuideRewriter;
import com.iptv.gateway.core.model.XtreamCredentials;
import com.iptv.gateway.core.playlist.ProxyUrlRewriter;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Service for the XMLTV guide: validates the account, fetches the guide and routes its icons through the image proxy.
 */
@Service
public class GuideService {

    private final XtreamApiPort xtreamApiPort;
    private final Duration timeout;

    public GuideService(XtreamApiPort xtreamApiPort, GatewayProperties properties) {
        this.xtreamApiPort = xtreamApiPort;
        this.timeout = properties.getGuide().getTimeout();
    }

    public String generate(XtreamCredentials credentials, String proxyBaseUrl, boolean proxyEnabled) {
        xtreamApiPort.authenticate(credentials);
        String guide = xtreamApiPort.fetchGuide(credentials, timeout);
        if (!proxyEnabled || proxyBaseUrl == null || proxyBaseUrl.isBlank()) {
            return guide;
        }
        return new GuideRewriter(new ProxyUrlRewriter(proxyBaseUrl)).rewriteIcons(guide);
    }
}
