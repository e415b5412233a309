package com.iptv.gateway.core.playlist;

import com.iptv.gateway.core.model.SeriesEpisodes;

import java.util.List;
import java.util.Map;

/**
 * Resolves episode listings for series that survived the group filter.
 * Series whose lookup failed are simply absent from the result.
 */
@FunctionalInterface
public interface EpisodeLookup {

    EpisodeLookup NONE = seriesIds -> Map.of();

    Map<String, SeriesEpisodes> resolve(List<String> seriesIds);
}
