package com.iptv.gateway.infrastructure.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for one catalog category, tagged with its content kind.
 */
public record CategoryResponse(
        @JsonProperty("category_id")
        String categoryId,
        @JsonProperty("category_name")
        String categoryName,
        @JsonProperty("parent_id")
        String parentId,
        @JsonProperty("content_type")
        String contentType
) {}
