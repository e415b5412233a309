package com.iptv.gateway.core.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Upstream catalog endpoints with their API action, content kind and time budget.
 * Stream lists of VOD and series are an order of magnitude larger than category lists
 * and are only fetched when a playlist is generated.
 */
public enum CatalogEndpoint {

    LIVE_CATEGORIES("get_live_categories", ContentKind.LIVE, Listing.CATEGORIES, Duration.ofSeconds(60), true),
    LIVE_STREAMS("get_live_streams", ContentKind.LIVE, Listing.STREAMS, Duration.ofSeconds(180), true),
    VOD_CATEGORIES("get_vod_categories", ContentKind.VOD, Listing.CATEGORIES, Duration.ofSeconds(60), false),
    SERIES_CATEGORIES("get_series_categories", ContentKind.SERIES, Listing.CATEGORIES, Duration.ofSeconds(60), false),
    VOD_STREAMS("get_vod_streams", ContentKind.VOD, Listing.STREAMS, Duration.ofSeconds(240), false),
    SERIES("get_series", ContentKind.SERIES, Listing.STREAMS, Duration.ofSeconds(240), false);

    public enum Listing { CATEGORIES, STREAMS }

    private final String action;
    private final ContentKind contentKind;
    private final Listing listing;
    private final Duration timeout;
    private final boolean mandatory;

    CatalogEndpoint(String action, ContentKind contentKind, Listing listing, Duration timeout, boolean mandatory) {
        this.action = action;
        this.contentKind = contentKind;
        this.listing = listing;
        this.timeout = timeout;
        this.mandatory = mandatory;
    }

    public String action() {
        return action;
    }

    public ContentKind contentKind() {
        return contentKind;
    }

    public Listing listing() {
        return listing;
    }

    public Duration timeout() {
        return timeout;
    }

    public boolean isMandatory() {
        return mandatory;
    }

    /**
     * Endpoints to fetch for a request.
     *
     * @param includeVod           add VOD and series category lists
     * @param includeSeriesStreams additionally add the VOD and series stream lists (playlist path only)
     */
    public static List<CatalogEndpoint> plan(boolean includeVod, boolean includeSeriesStreams) {
        List<CatalogEndpoint> endpoints = new ArrayList<>(List.of(LIVE_CATEGORIES, LIVE_STREAMS));
        if (includeVod) {
            endpoints.add(VOD_CATEGORIES);
            endpoints.add(SERIES_CATEGORIES);
            if (includeSeriesStreams) {
                endpoints.add(VOD_STREAMS);
                endpoints.add(SERIES);
            }
        }
        return endpoints;
    }
}
