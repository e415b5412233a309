package com.iptv.gateway.core.playlist;

import com.iptv.gateway.core.model.AccountInfo;
import com.iptv.gateway.core.model.Catalog;
import com.iptv.gateway.core.model.Category;
import com.iptv.gateway.core.model.ContentKind;
import com.iptv.gateway.core.model.Episode;
import com.iptv.gateway.core.model.FilterSpec;
import com.iptv.gateway.core.model.PlaylistOptions;
import com.iptv.gateway.core.model.PlaylistRecord;
import com.iptv.gateway.core.model.SeriesEpisodes;
import com.iptv.gateway.core.model.StreamEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PlaylistSynthesizerTest {

    private static final AccountInfo ACCOUNT = new AccountInfo("user", "pass", "http://media:8080");

    private final PlaylistSynthesizer synthesizer = new PlaylistSynthesizer();

    // ========================================================================
    // Fixtures
    // ========================================================================

    private static Catalog catalog() {
        List<Category> categories = List.of(
                new Category("1", "News", null, ContentKind.LIVE),
                new Category("2", "Sports", null, ContentKind.LIVE),
                new Category("10", "Action", null, ContentKind.VOD),
                new Category("1", "Drama", null, ContentKind.SERIES));
        List<StreamEntry> streams = List.of(
                new StreamEntry("100", "BBC News", "1", ContentKind.LIVE, "http://img/bbc.png",
                        null, "bbc.uk", null, null),
                new StreamEntry("101", "Sky Sports", "2", ContentKind.LIVE, null, null, "", null, null),
                new StreamEntry("200", "Heat", "10", ContentKind.VOD, null, "mkv", null, "1700000000", 1234L),
                new StreamEntry("300", "The Show", "1", ContentKind.SERIES, "http://img/show.jpg",
                        null, null, null, null));
        return new Catalog(categories, streams);
    }

    private static SeriesEpisodes showEpisodes() {
        Map<String, List<Episode>> seasons = new LinkedHashMap<>();
        seasons.put("2", List.of(new Episode("e3", "2", "1", "Return", null, null, null)));
        seasons.put("1", List.of(
                new Episode("e1", "1", "1", "Pilot", "mkv", "1690000000", 999L),
                new Episode("e2", "1", null, "Second", null, null, null)));
        return new SeriesEpisodes("300", seasons);
    }

    private static PlaylistOptions direct() {
        return new PlaylistOptions(ACCOUNT, null, false, true, false, null);
    }

    private static PlaylistOptions proxied(String base) {
        return new PlaylistOptions(ACCOUNT, base, true, true, false, null);
    }

    /**
     * Episode lookup that records the ids it was asked for.
     */
    private static final class RecordingLookup implements EpisodeLookup {

        private final List<List<String>> calls = new ArrayList<>();
        private final Map<String, SeriesEpisodes> answer;

        RecordingLookup(Map<String, SeriesEpisodes> answer) {
            this.answer = answer;
        }

        @Override
        public Map<String, SeriesEpisodes> resolve(List<String> seriesIds) {
            calls.add(List.copyOf(seriesIds));
            return answer;
        }
    }

    // ========================================================================
    // Rendering
    // ========================================================================

    @Nested
    @DisplayName("Rendering")
    class Rendering {

        @Test
        @DisplayName("Renders live, VOD and expanded series records in catalog order")
        void rendersFullPlaylist() {
            String playlist = synthesizer.synthesize(catalog(), FilterSpec.NONE, direct(),
                    new RecordingLookup(Map.of("300", showEpisodes())));

            assertThat(playlist).isEqualTo("#EXTM3U\n"
                    + "#EXTINF:0 tvg-name=\"BBC News\" group-title=\"News\" tvg-logo=\"http://img/bbc.png\",BBC News\n"
                    + "http://media:8080/live/user/pass/100.ts\n"
                    + "#EXTINF:0 tvg-name=\"Sky Sports\" group-title=\"Sports\",Sky Sports\n"
                    + "http://media:8080/live/user/pass/101.ts\n"
                    + "#EXTINF:0 tvg-name=\"Heat\" group-title=\"VOD - Action\" added=\"1700000000\",Heat\n"
                    + "#EXTBYT:1234\n"
                    + "http://media:8080/movie/user/pass/200.mkv\n"
                    + "#EXTINF:0 tvg-name=\"The Show\" group-title=\"Series - Drama\" tvg-logo=\"http://img/show.jpg\""
                    + " added=\"1690000000\",The Show - S01 - E01 - Pilot\n"
                    + "#EXTBYT:999\n"
                    + "http://media:8080/series/user/pass/e1.mkv\n"
                    + "#EXTINF:0 tvg-name=\"The Show\" group-title=\"Series - Drama\" tvg-logo=\"http://img/show.jpg\""
                    + ",The Show - S01 - E02 - Second\n"
                    + "http://media:8080/series/user/pass/e2.mp4\n"
                    + "#EXTINF:0 tvg-name=\"The Show\" group-title=\"Series - Drama\" tvg-logo=\"http://img/show.jpg\""
                    + ",The Show - S02 - E01 - Return\n"
                    + "http://media:8080/series/user/pass/e3.mp4\n");
        }

        @Test
        @DisplayName("Series without resolved episodes fall back to one record for the series")
        void seriesFallback() {
            List<PlaylistRecord> records = synthesizer.buildRecords(catalog(), FilterSpec.NONE, direct(),
                    new RecordingLookup(Map.of()));

            PlaylistRecord series = records.get(records.size() - 1);
            assertThat(series.displayName()).isEqualTo("The Show");
            assertThat(series.groupTitle()).isEqualTo("Series - Drama");
            assertThat(series.mediaUrl()).isEqualTo("http://media:8080/series/user/pass/300.mp4");
        }

        @Test
        @DisplayName("Unknown categories and missing names get placeholders")
        void placeholders() {
            Catalog catalog = new Catalog(List.of(), List.of(
                    new StreamEntry("1", null, "999", ContentKind.LIVE, null, null, null, null, null),
                    new StreamEntry("2", "Film", null, ContentKind.VOD, null, null, null, null, null),
                    new StreamEntry("3", null, "7", ContentKind.SERIES, null, null, null, null, null)));

            List<PlaylistRecord> records = synthesizer.buildRecords(catalog, FilterSpec.NONE, direct(),
                    EpisodeLookup.NONE);

            assertThat(records).extracting(PlaylistRecord::displayName)
                    .containsExactly("Unknown", "Film", "Unknown Series");
            assertThat(records).extracting(PlaylistRecord::groupTitle)
                    .containsExactly("Uncategorized", "VOD - Uncategorized", "Series - Uncategorized");
        }

        @Test
        @DisplayName("Category ids are looked up within the stream's own content kind")
        void categoryLookupIsScopedByKind() {
            List<PlaylistRecord> records = synthesizer.buildRecords(catalog(), FilterSpec.NONE, direct(),
                    new RecordingLookup(Map.of()));

            assertThat(records.get(0).groupTitle()).isEqualTo("News");
            assertThat(records.get(records.size() - 1).groupTitle()).isEqualTo("Series - Drama");
        }

        @Test
        @DisplayName("Channel ids are emitted under the requested tag when present")
        void channelIdTag() {
            PlaylistOptions options = new PlaylistOptions(ACCOUNT, null, false, false, true, "tvg-id");

            List<PlaylistRecord> records = synthesizer.buildRecords(catalog(), FilterSpec.NONE, options,
                    EpisodeLookup.NONE);

            assertThat(records.get(0).extraTags()).containsExactly(new PlaylistRecord.Tag("tvg-id", "bbc.uk"));
            assertThat(records.get(1).extraTags()).isEmpty();
        }

        @Test
        @DisplayName("Rendering the same input twice gives identical output")
        void idempotent() {
            RecordingLookup lookup = new RecordingLookup(Map.of("300", showEpisodes()));

            String first = synthesizer.synthesize(catalog(), FilterSpec.NONE, direct(), lookup);
            String second = synthesizer.synthesize(catalog(), FilterSpec.NONE, direct(), lookup);

            assertThat(second).isEqualTo(first);
        }

        @Test
        @DisplayName("Live channels and series fallbacks carry neither added nor size")
        void addedAndSizeOnlyForVod() {
            Catalog catalog = new Catalog(catalog().categories(), List.of(
                    new StreamEntry("100", "BBC", "1", ContentKind.LIVE, null, null, null, "1600000000", 77L),
                    new StreamEntry("300", "The Show", "1", ContentKind.SERIES, null, null, null,
                            "1650000000", 88L)));

            String playlist = synthesizer.synthesize(catalog, FilterSpec.NONE, direct(), EpisodeLookup.NONE);

            assertThat(playlist).isEqualTo("#EXTM3U\n"
                    + "#EXTINF:0 tvg-name=\"BBC\" group-title=\"News\",BBC\n"
                    + "http://media:8080/live/user/pass/100.ts\n"
                    + "#EXTINF:0 tvg-name=\"The Show\" group-title=\"Series - Drama\",The Show\n"
                    + "http://media:8080/series/user/pass/300.mp4\n");
        }

        @Test
        @DisplayName("Numeric seasons are sorted by value and named seasons come last")
        void seasonOrder() {
            Map<String, List<Episode>> seasons = new LinkedHashMap<>();
            seasons.put("Specials", List.of(new Episode("sp", "Specials", "1", "Behind the scenes", null, null, null)));
            seasons.put("10", List.of(new Episode("e10", "10", "1", "Finale", null, null, null)));
            seasons.put("2", List.of(new Episode("e2", "2", "1", "Start", null, null, null)));
            Catalog catalog = new Catalog(catalog().categories(), List.of(
                    new StreamEntry("300", "The Show", "1", ContentKind.SERIES, null, null, null, null, null)));

            List<PlaylistRecord> records = synthesizer.buildRecords(catalog, FilterSpec.NONE, direct(),
                    new RecordingLookup(Map.of("300", new SeriesEpisodes("300", seasons))));

            assertThat(records).extracting(PlaylistRecord::displayName).containsExactly(
                    "The Show - S02 - E01 - Start",
                    "The Show - S10 - E01 - Finale",
                    "The Show - SSpecials - E01 - Behind the scenes");
        }
    }

    // ========================================================================
    // Proxy rewriting
    // ========================================================================

    @Nested
    @DisplayName("Proxy rewriting")
    class ProxyRewriting {

        @Test
        @DisplayName("Logo and media URLs point at the proxy endpoints with the original URL encoded")
        void rewritesUrls() {
            List<PlaylistRecord> records = synthesizer.buildRecords(catalog(), FilterSpec.NONE,
                    proxied("http://gw:5000/"), EpisodeLookup.NONE);

            PlaylistRecord live = records.get(0);
            assertThat(live.logoUrl()).isEqualTo("http://gw:5000/image-proxy/http%3A%2F%2Fimg%2Fbbc.png");
            assertThat(live.mediaUrl())
                    .isEqualTo("http://gw:5000/stream-proxy/http%3A%2F%2Fmedia%3A8080%2Flive%2Fuser%2Fpass%2F100.ts");
        }

        @Test
        @DisplayName("Every record is either fully direct or fully proxied")
        void noMixedRecords() {
            List<PlaylistRecord> proxiedRecords = synthesizer.buildRecords(catalog(), FilterSpec.NONE,
                    proxied("http://gw:5000"), new RecordingLookup(Map.of("300", showEpisodes())));
            List<PlaylistRecord> directRecords = synthesizer.buildRecords(catalog(), FilterSpec.NONE,
                    direct(), new RecordingLookup(Map.of("300", showEpisodes())));

            assertThat(proxiedRecords).allSatisfy(record -> {
                assertThat(record.mediaUrl()).startsWith("http://gw:5000/stream-proxy/");
                if (record.logoUrl() != null) {
                    assertThat(record.logoUrl()).startsWith("http://gw:5000/image-proxy/");
                }
            });
            assertThat(directRecords).allSatisfy(record ->
                    assertThat(record.mediaUrl()).startsWith("http://media:8080/"));
        }
    }

    // ========================================================================
    // Filtering
    // ========================================================================

    @Nested
    @DisplayName("Filtering")
    class Filtering {

        @Test
        @DisplayName("Only series that pass the filter have their episodes resolved")
        void resolvesOnlyFilteredSeries() {
            RecordingLookup lookup = new RecordingLookup(Map.of());
            Catalog catalog = new Catalog(catalog().categories(), List.of(
                    new StreamEntry("300", "The Show", "1", ContentKind.SERIES, null, null, null, null, null),
                    new StreamEntry("301", "Other", "5", ContentKind.SERIES, null, null, null, null, null)));

            synthesizer.buildRecords(catalog, new FilterSpec(List.of("drama"), List.of()), direct(), lookup);

            assertThat(lookup.calls).containsExactly(List.of("300"));
        }

        @Test
        @DisplayName("No lookup happens when no series passes the filter")
        void skipsLookupWhenNothingPasses() {
            RecordingLookup lookup = new RecordingLookup(Map.of());

            List<PlaylistRecord> records = synthesizer.buildRecords(catalog(),
                    new FilterSpec(List.of("news"), List.of()), direct(), lookup);

            assertThat(lookup.calls).isEmpty();
            assertThat(records).extracting(PlaylistRecord::tvgName).containsExactly("BBC News");
        }

        @Test
        @DisplayName("No lookup happens when VOD is not requested")
        void skipsLookupWithoutVod() {
            RecordingLookup lookup = new RecordingLookup(Map.of("300", showEpisodes()));
            PlaylistOptions liveOnly = new PlaylistOptions(ACCOUNT, null, false, false, false, null);

            synthesizer.buildRecords(catalog(), FilterSpec.NONE, liveOnly, lookup);

            assertThat(lookup.calls).isEmpty();
        }

        @Test
        @DisplayName("Unwanted groups are left out while order is kept")
        void excludesUnwanted() {
            List<PlaylistRecord> records = synthesizer.buildRecords(catalog(),
                    new FilterSpec(List.of(), List.of("sports", "vod - *")), direct(), new RecordingLookup(Map.of()));

            assertThat(records).extracting(PlaylistRecord::tvgName).containsExactly("BBC News", "The Show");
        }
    }
}
