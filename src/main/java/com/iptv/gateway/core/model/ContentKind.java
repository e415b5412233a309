package com.iptv.gateway.core.model;

/**
 * Classification of catalog entries. The upstream API does not label entries itself,
 * so every category and stream is tagged with the kind of the endpoint it came from.
 */
public enum ContentKind {

    LIVE("live"),
    VOD("vod"),
    SERIES("series");

    private final String wireName;

    ContentKind(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Value used for the {@code content_type} field in API responses.
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Group title shown in the playlist and used for filter matching.
     */
    public String groupTitle(String categoryName) {
        return switch (this) {
            case LIVE -> categoryName;
            case VOD -> "VOD - " + categoryName;
            case SERIES -> "Series - " + categoryName;
        };
    }

    /**
     * Path segment of the media server URL for this kind.
     */
    public String mediaPathSegment() {
        return switch (this) {
            case LIVE -> "live";
            case VOD -> "movie";
            case SERIES -> "series";
        };
    }
}
