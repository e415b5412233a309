package com.iptv.gateway.core.model;

import java.util.List;

/**
 * Aggregated categories and streams of one request, every entry tagged with its content kind.
 */
public record Catalog(
        List<Category> categories,
        List<StreamEntry> streams
) {

    public Catalog {
        categories = List.copyOf(categories);
        streams = List.copyOf(streams);
    }
}
