package com.iptv.gateway.infrastructure.api.controller;

import com.iptv.gateway.application.service.MediaProxyService;
import com.iptv.gateway.application.service.MediaProxyService.ProxiedMedia;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

/**
 * Pass-through endpoints for media streams and images. The upstream URL is the
 * percent-encoded last path segment and arrives here already decoded.
 */
@RestController
public class ProxyController {

    private final MediaProxyService mediaProxyService;

    public ProxyController(MediaProxyService mediaProxyService) {
        this.mediaProxyService = mediaProxyService;
    }

    @GetMapping("/stream-proxy/{encodedUrl}")
    public ResponseEntity<StreamingResponseBody> proxyStream(@PathVariable String encodedUrl) {
        return relay(mediaProxyService.openStream(encodedUrl));
    }

    @GetMapping("/image-proxy/{encodedUrl}")
    public ResponseEntity<StreamingResponseBody> proxyImage(@PathVariable String encodedUrl) {
        return relay(mediaProxyService.openImage(encodedUrl));
    }

    private ResponseEntity<StreamingResponseBody> relay(ProxiedMedia media) {
        ResponseEntity.BodyBuilder response = ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_TYPE, media.headers().contentType())
                .header(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "*");
        media.headers().contentLength().ifPresent(response::contentLength);
        StreamingResponseBody body = out -> mediaProxyService.transfer(media, out);
        return response.body(body);
    }
}
