package com.iptv.gateway.core.model;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Episodes of one series grouped by season key, in the order the upstream returned them.
 */
public class SeriesEpisodes {

    private static final Comparator<Map.Entry<String, List<Episode>>> SEASON_ORDER =
            Comparator.comparing((Map.Entry<String, List<Episode>> e) -> !isNumeric(e.getKey()))
                    .thenComparing((a, b) -> isNumeric(a.getKey())
                            ? new BigInteger(a.getKey()).compareTo(new BigInteger(b.getKey()))
                            : 0);

    private final String seriesId;
    private final Map<String, List<Episode>> seasons;

    public SeriesEpisodes(String seriesId, Map<String, List<Episode>> seasons) {
        this.seriesId = Objects.requireNonNull(seriesId, "seriesId must not be null");
        Map<String, List<Episode>> copy = new LinkedHashMap<>();
        seasons.forEach((season, episodes) -> copy.put(season, List.copyOf(episodes)));
        this.seasons = Collections.unmodifiableMap(copy);
    }

    public String getSeriesId() {
        return seriesId;
    }

    public Map<String, List<Episode>> getSeasons() {
        return seasons;
    }

    public boolean isEmpty() {
        return seasons.values().stream().allMatch(List::isEmpty);
    }

    /**
     * Seasons ordered by numeric season ascending. Non-numeric season keys come last
     * and keep their original relative order.
     */
    public List<Map.Entry<String, List<Episode>>> sortedSeasons() {
        List<Map.Entry<String, List<Episode>>> entries = new ArrayList<>(seasons.entrySet());
        entries.sort(SEASON_ORDER);
        return entries;
    }

    private static boolean isNumeric(String key) {
        if (key == null || key.isEmpty()) {
            return false;
        }
        for (int i = 0; i < key.length(); i++) {
            if (!Character.isDigit(key.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
