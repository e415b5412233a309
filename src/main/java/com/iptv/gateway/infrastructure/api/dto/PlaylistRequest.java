package com.iptv.gateway.infrastructure.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * Request DTO for playlist generation via POST, for filter lists too long for a query string.
 * Flags are strings and count as set when equal to {@code "true"}, ignoring case.
 */
public record PlaylistRequest(
        @NotBlank(message = "url is required")
        String url,
        @NotBlank(message = "username is required")
        String username,
        @NotBlank(message = "password is required")
        String password,
        @JsonProperty("proxy_url")
        String proxyUrl,
        @JsonProperty("wanted_groups")
        String wantedGroups,
        @JsonProperty("unwanted_groups")
        String unwantedGroups,
        @JsonProperty("nostreamproxy")
        String noStreamProxy,
        @JsonProperty("include_vod")
        String includeVod,
        @JsonProperty("include_channel_id")
        String includeChannelId,
        @JsonProperty("channel_id_tag")
        String channelIdTag
) {}
