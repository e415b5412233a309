package com.iptv.gateway.core.playlist;

import com.iptv.gateway.core.filter.GroupFilter;
import com.iptv.gateway.core.model.Catalog;
import com.iptv.gateway.core.model.Category;
import com.iptv.gateway.core.model.ContentKind;
import com.iptv.gateway.core.model.Episode;
import com.iptv.gateway.core.model.FilterSpec;
import com.iptv.gateway.core.model.PlaylistOptions;
import com.iptv.gateway.core.model.PlaylistRecord;
import com.iptv.gateway.core.model.SeriesEpisodes;
import com.iptv.gateway.core.model.StreamEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns a filtered catalog into playlist records and renders them as M3U text.
 *
 * <p>Records come out in the order streams appear in the catalog. Series expand into one record
 * per episode, seasons in numeric order; series without resolved episodes fall back to a single
 * record pointing at the series id. Episodes are only resolved for series that pass the filter.
 */
public class PlaylistSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(PlaylistSynthesizer.class);

    static final String UNCATEGORIZED = "Uncategorized";
    static final String UNKNOWN_NAME = "Unknown";
    static final String UNKNOWN_SERIES_NAME = "Unknown Series";
    static final String ADDED_TAG = "added";

    private final M3uWriter writer = new M3uWriter();

    public String synthesize(Catalog catalog, FilterSpec filterSpec, PlaylistOptions options,
                             EpisodeLookup episodeLookup) {
        return writer.write(buildRecords(catalog, filterSpec, options, episodeLookup));
    }

    public List<PlaylistRecord> buildRecords(Catalog catalog, FilterSpec filterSpec, PlaylistOptions options,
                                             EpisodeLookup episodeLookup) {
        Map<ContentKind, Map<String, String>> categoryNames = indexCategories(catalog.categories());
        GroupFilter filter = new GroupFilter(filterSpec);
        RecordFactory factory = new RecordFactory(options);

        Map<String, SeriesEpisodes> episodes = options.includeVod()
                ? resolveEpisodes(catalog.streams(), categoryNames, filter, episodeLookup)
                : Map.of();

        if (filter.isActive()) {
            log.info("Filtering {} streams", catalog.streams().size());
        }
        List<PlaylistRecord> records = new ArrayList<>();
        Set<String> includedGroups = new TreeSet<>();
        Set<String> allGroups = new TreeSet<>();

        for (StreamEntry stream : catalog.streams()) {
            String categoryName = categoryName(categoryNames, stream);
            String groupTitle = stream.getContentKind().groupTitle(categoryName);
            allGroups.add(groupTitle);
            if (!filter.includes(categoryName, groupTitle)) {
                continue;
            }
            includedGroups.add(groupTitle);

            switch (stream.getContentKind()) {
                case LIVE, VOD -> records.add(factory.single(stream, groupTitle));
                case SERIES -> {
                    SeriesEpisodes seriesEpisodes = episodes.get(stream.getId());
                    if (seriesEpisodes == null || seriesEpisodes.isEmpty()) {
                        records.add(factory.seriesFallback(stream, groupTitle));
                    } else {
                        records.addAll(factory.episodes(stream, groupTitle, seriesEpisodes));
                    }
                }
            }
        }

        if (log.isDebugEnabled()) {
            Set<String> excludedGroups = new TreeSet<>(allGroups);
            excludedGroups.removeAll(includedGroups);
            log.debug("Groups included after filtering: {}", includedGroups);
            log.debug("Groups excluded after filtering: {}", excludedGroups);
        }
        log.info("Playlist built with {} records from {} groups", records.size(), includedGroups.size());
        return records;
    }

    private Map<String, SeriesEpisodes> resolveEpisodes(List<StreamEntry> streams,
                                                        Map<ContentKind, Map<String, String>> categoryNames,
                                                        GroupFilter filter,
                                                        EpisodeLookup episodeLookup) {
        List<String> seriesIds = new ArrayList<>();
        int seriesCount = 0;
        for (StreamEntry stream : streams) {
            if (stream.getContentKind() != ContentKind.SERIES) {
                continue;
            }
            seriesCount++;
            String categoryName = categoryName(categoryNames, stream);
            if (filter.includes(categoryName, ContentKind.SERIES.groupTitle(categoryName))) {
                seriesIds.add(stream.getId());
            }
        }
        if (seriesIds.isEmpty()) {
            return Map.of();
        }
        log.info("Resolving episodes for {} of {} series", seriesIds.size(), seriesCount);
        return episodeLookup.resolve(seriesIds);
    }

    private static Map<ContentKind, Map<String, String>> indexCategories(List<Category> categories) {
        Map<ContentKind, Map<String, String>> index = new EnumMap<>(ContentKind.class);
        for (Category category : categories) {
            index.computeIfAbsent(category.getContentKind(), kind -> new HashMap<>())
                    .put(category.getId(), category.getName());
        }
        return index;
    }

    private static String categoryName(Map<ContentKind, Map<String, String>> index, StreamEntry stream) {
        Map<String, String> names = index.get(stream.getContentKind());
        if (names == null || stream.getCategoryId() == null) {
            return UNCATEGORIZED;
        }
        return names.getOrDefault(stream.getCategoryId(), UNCATEGORIZED);
    }

    /**
     * Builds records for one request: resolves names, tags and direct or proxied URLs.
     */
    private static final class RecordFactory {

        private final PlaylistOptions options;
        private final MediaUrlBuilder mediaUrls;
        private final ProxyUrlRewriter proxy;

        RecordFactory(PlaylistOptions options) {
            this.options = options;
            this.mediaUrls = new MediaUrlBuilder(options.account());
            this.proxy = options.proxyEnabled() ? new ProxyUrlRewriter(options.proxyBaseUrl()) : null;
        }

        PlaylistRecord single(StreamEntry stream, String groupTitle) {
            String name = nameOf(stream);
            String mediaUrl = mediaUrls.build(stream.getContentKind(), stream.getId(), stream.getContainerExtension());
            // added and size only describe VOD files
            boolean vod = stream.getContentKind() == ContentKind.VOD;
            return new PlaylistRecord(name, name, groupTitle, logo(stream), media(mediaUrl),
                    tags(stream, vod ? stream.getAdded() : null), vod ? stream.getSizeBytes() : null);
        }

        PlaylistRecord seriesFallback(StreamEntry stream, String groupTitle) {
            String name = nameOf(stream);
            String mediaUrl = mediaUrls.build(ContentKind.SERIES, stream.getId(), null);
            return new PlaylistRecord(name, name, groupTitle, logo(stream), media(mediaUrl),
                    tags(stream, null), null);
        }

        List<PlaylistRecord> episodes(StreamEntry stream, String groupTitle, SeriesEpisodes seriesEpisodes) {
            String name = nameOf(stream);
            String logo = logo(stream);
            List<PlaylistRecord> records = new ArrayList<>();
            for (Map.Entry<String, List<Episode>> season : seriesEpisodes.sortedSeasons()) {
                int position = 0;
                for (Episode episode : season.getValue()) {
                    position++;
                    String episodeNumber = episode.getEpisodeNumber() != null
                            ? episode.getEpisodeNumber()
                            : String.valueOf(position);
                    String title = name
                            + " - S" + zeroPad(season.getKey())
                            + " - E" + zeroPad(episodeNumber)
                            + " - " + (episode.getTitle() == null ? "" : episode.getTitle());
                    String mediaUrl = mediaUrls.build(ContentKind.SERIES, episode.getId(),
                            episode.getContainerExtension());
                    records.add(new PlaylistRecord(name, title, groupTitle, logo, media(mediaUrl),
                            tags(stream, episode.getAdded()), episode.getSizeBytes()));
                }
            }
            return records;
        }

        private String nameOf(StreamEntry stream) {
            if (stream.getName() != null) {
                return stream.getName();
            }
            return stream.getContentKind() == ContentKind.SERIES ? UNKNOWN_SERIES_NAME : UNKNOWN_NAME;
        }

        private String logo(StreamEntry stream) {
            String icon = stream.getIconUrl();
            if (icon == null || icon.isEmpty()) {
                return null;
            }
            return proxy != null ? proxy.imageUrl(icon) : icon;
        }

        private String media(String directUrl) {
            return proxy != null ? proxy.streamUrl(directUrl) : directUrl;
        }

        private List<PlaylistRecord.Tag> tags(StreamEntry stream, String added) {
            List<PlaylistRecord.Tag> tags = new ArrayList<>(2);
            if (options.includeChannelId() && stream.getEpgChannelId() != null && !stream.getEpgChannelId().isBlank()) {
                tags.add(new PlaylistRecord.Tag(options.channelIdTag(), stream.getEpgChannelId()));
            }
            if (added != null && !added.isBlank()) {
                tags.add(new PlaylistRecord.Tag(ADDED_TAG, added));
            }
            return tags;
        }

        private static String zeroPad(String value) {
            if (value.length() >= 2) {
                return value;
            }
            return "0".repeat(2 - value.length()) + value;
        }
    }
}
