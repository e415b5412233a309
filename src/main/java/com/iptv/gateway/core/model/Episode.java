package com.iptv.gateway.core.model;

import java.util.Objects;

/**
 * One episode of a series, as returned by the series info endpoint.
 */
public class Episode {

    private final String id;
    private final String seasonNumber;
    private final String episodeNumber;
    private final String title;
    private final String containerExtension;
    private final String added;
    private final Long sizeBytes;

    public Episode(String id, String seasonNumber, String episodeNumber, String title,
                   String containerExtension, String added, Long sizeBytes) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.seasonNumber = seasonNumber;
        this.episodeNumber = episodeNumber;
        this.title = title;
        this.containerExtension = containerExtension;
        this.added = added;
        this.sizeBytes = sizeBytes;
    }

    public String getId() {
        return id;
    }

    public String getSeasonNumber() {
        return seasonNumber;
    }

    public String getEpisodeNumber() {
        return episodeNumber;
    }

    public String getTitle() {
        return title;
    }

    public String getContainerExtension() {
        return containerExtension;
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
        Episode that = (Episode) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }
}
