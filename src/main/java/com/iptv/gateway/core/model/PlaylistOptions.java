package com.iptv.gateway.core.model;

/**
 * Per-request rendering options for playlist synthesis.
 *
 * @param account          account and media server the URLs point at
 * @param proxyBaseUrl     base URL of this gateway, used for proxy rewriting
 * @param proxyEnabled     whether logo and media URLs are routed through the proxy endpoints
 * @param includeVod       whether VOD and series content was requested
 * @param includeChannelId whether live records carry their EPG channel id
 * @param channelIdTag     tag name holding the EPG channel id
 */
public record PlaylistOptions(
        AccountInfo account,
        String proxyBaseUrl,
        boolean proxyEnabled,
        boolean includeVod,
        boolean includeChannelId,
        String channelIdTag
) {

    public static final String DEFAULT_CHANNEL_ID_TAG = "channel-id";

    public PlaylistOptions {
        if (channelIdTag == null || channelIdTag.isBlank()) {
            channelIdTag = DEFAULT_CHANNEL_ID_TAG;
        }
    }
}
