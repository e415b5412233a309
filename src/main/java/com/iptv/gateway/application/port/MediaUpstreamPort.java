package com.iptv.gateway.application.port;

import com.iptv.gateway.core.proxy.UpstreamMedia;

import java.time.Duration;

/**
 * Port for opening proxied media and image URLs without consuming their bodies.
 */
public interface MediaUpstreamPort {

    /**
     * Issues a GET and returns as soon as the response headers arrived. The caller owns the result
     * and must close it.
     *
     * @param url         absolute upstream URL
     * @param readTimeout maximum silence between reads
     * @throws com.iptv.gateway.core.exception.ProxyUpstreamTimeoutException if the upstream does not answer in time
     * @throws com.iptv.gateway.core.exception.ProxyFailureException         for any other failure to open
     */
    UpstreamMedia open(String url, Duration readTimeout);
}
