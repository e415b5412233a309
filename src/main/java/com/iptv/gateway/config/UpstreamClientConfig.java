package com.iptv.gateway.config;

import okhttp3.Dns;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * HTTP client used for every upstream call. Name resolution is an injected {@link Dns} bean,
 * so a custom resolver is configured here instead of patching process-wide state.
 */
@Configuration
public class UpstreamClientConfig {

    @Bean
    public Dns upstreamDns() {
        return Dns.SYSTEM;
    }

    @Bean
    public OkHttpClient upstreamHttpClient(Dns upstreamDns, GatewayProperties properties) {
        String userAgent = properties.getUpstream().getUserAgent();
        return new OkHttpClient.Builder()
                .dns(upstreamDns)
                .connectTimeout(properties.getUpstream().getConnectTimeout())
                // errors are never retried automatically; callers re-issue the request
                .retryOnConnectionFailure(false)
                .followRedirects(true)
                .addInterceptor(chain -> chain.proceed(chain.request().newBuilder()
                        .header("User-Agent", userAgent)
                        .build()))
                .build();
    }
}
