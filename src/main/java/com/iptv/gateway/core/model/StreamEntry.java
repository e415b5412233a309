package com.iptv.gateway.core.model;

import java.util.Objects;

/**
 * A live channel, a movie or a series as listed by the upstream catalog.
 * For series the id is the series id, otherwise the stream id.
 * One entry may expand into many playlist records (series case).
 */
public class StreamEntry {

    private final String id;
    private final String name;
    private final String categoryId;
    private final ContentKind contentKind;
    private final String iconUrl;
    private final String containerExtension;
    private final String epgChannelId;
    private final String added;
    private final Long sizeBytes;

    public StreamEntry(String id, String name, String categoryId, ContentKind contentKind,
                       String iconUrl, String containerExtension, String epgChannelId,
                       String added, Long sizeBytes) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.name = name;
        this.categoryId = categoryId;
        this.contentKind = Objects.requireNonNull(contentKind, "contentKind must not be null");
        this.iconUrl = iconUrl;
        this.containerExtension = containerExtension;
        this.epgChannelId = epgChannelId;
        this.added = added;
        this.sizeBytes = sizeBytes;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getCategoryId() {
        return categoryId;
    }

    public ContentKind getContentKind() {
        return contentKind;
    }

    public String getIconUrl() {
        return iconUrl;
    }

    public String getContainerExtension() {
        return containerExtension;
    }

    public String getEpgChannelId() {
        return epgChannelId;
    }

    public String getAdded() {
        return added;
    }

    public Long getSizeBytes() {
        return sizeBytes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StreamEntry that = (StreamEntry) o;
        return Objects.equals(id, that.id) && contentKind == that.contentKind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, contentKind);
    }
}
