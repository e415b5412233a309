package com.iptv.gateway.infrastructure.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.iptv.gateway.core.exception.AuthResponseMalformedException;
import com.iptv.gateway.core.exception.InvalidCatalogFormatException;
import com.iptv.gateway.core.exception.InvalidCredentialsException;
import com.iptv.gateway.core.model.AccountInfo;
import com.iptv.gateway.core.model.Category;
import com.iptv.gateway.core.model.ContentKind;
import com.iptv.gateway.core.model.Episode;
import com.iptv.gateway.core.model.SeriesEpisodes;
import com.iptv.gateway.core.model.StreamEntry;
import com.iptv.gateway.core.model.XtreamCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps upstream JSON replies to domain objects, tagging entries with their content kind.
 */
@Component
public class XtreamResponseParser {

    private static final Logger log = LoggerFactory.getLogger(XtreamResponseParser.class);

    static final String DEFAULT_SEASON = "1";

    public AccountInfo account(JsonNode reply, XtreamCredentials credentials) {
        if (reply == null || !reply.isObject()) {
            throw new AuthResponseMalformedException("Account response is not a JSON object");
        }
        JsonNode userInfo = reply.get("user_info");
        JsonNode serverInfo = reply.get("server_info");
        if (userInfo == null || !userInfo.isObject() || serverInfo == null || !serverInfo.isObject()) {
            throw new InvalidCredentialsException(
                    "Server response missing required data (user_info or server_info)");
        }
        if ("0".equals(text(userInfo, "auth"))) {
            throw new InvalidCredentialsException("Upstream rejected the credentials");
        }
        String host = text(serverInfo, "url");
        String port = text(serverInfo, "port");
        if (isBlank(host) || isBlank(port)) {
            throw new AuthResponseMalformedException("server_info lacks url or port");
        }
        String username = orDefault(text(userInfo, "username"), credentials.username());
        String password = orDefault(text(userInfo, "password"), credentials.password());
        return new AccountInfo(username, password, "http://" + host + ":" + port);
    }

    public List<Category> categories(JsonNode reply, ContentKind kind, String action) {
        requireList(reply, action);
        List<Category> categories = new ArrayList<>(reply.size());
        for (JsonNode node : reply) {
            String id = text(node, "category_id");
            if (id == null) {
                continue;
            }
            categories.add(new Category(id, orDefault(text(node, "category_name"), ""),
                    text(node, "parent_id"), kind));
        }
        return categories;
    }

    public List<StreamEntry> streams(JsonNode reply, ContentKind kind, String action) {
        requireList(reply, action);
        List<StreamEntry> streams = new ArrayList<>(reply.size());
        int skipped = 0;
        for (JsonNode node : reply) {
            String id = kind == ContentKind.SERIES
                    ? orDefault(text(node, "series_id"), text(node, "stream_id"))
                    : text(node, "stream_id");
            if (id == null) {
                skipped++;
                continue;
            }
            String icon = text(node, "stream_icon");
            if (isBlank(icon) && kind == ContentKind.SERIES) {
                icon = text(node, "cover");
            }
            streams.add(new StreamEntry(
                    id,
                    text(node, "name"),
                    text(node, "category_id"),
                    kind,
                    icon,
                    text(node, "container_extension"),
                    text(node, "epg_channel_id"),
                    text(node, "added"),
                    size(node)));
        }
        if (skipped > 0) {
            log.debug("Skipped {} {} entries without id", skipped, action);
        }
        return streams;
    }

    /**
     * Reads the {@code episodes} field of a series info reply. It is either an object keyed by
     * season number or a flat list, which is grouped by each episode's {@code season} (default 1).
     */
    public Optional<SeriesEpisodes> seriesEpisodes(JsonNode reply, String seriesId) {
        if (reply == null || !reply.isObject()) {
            return Optional.empty();
        }
        JsonNode episodes = reply.get("episodes");
        if (episodes == null || episodes.isEmpty()) {
            return Optional.empty();
        }

        Map<String, List<Episode>> seasons = new LinkedHashMap<>();
        if (episodes.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = episodes.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> season = fields.next();
                List<Episode> list = seasons.computeIfAbsent(season.getKey(), key -> new ArrayList<>());
                if (season.getValue().isArray()) {
                    for (JsonNode node : season.getValue()) {
                        episode(node, season.getKey()).ifPresent(list::add);
                    }
                }
            }
        } else if (episodes.isArray()) {
            for (JsonNode node : episodes) {
                String season = orDefault(text(node, "season"), DEFAULT_SEASON);
                episode(node, season).ifPresent(e -> seasons.computeIfAbsent(season, key -> new ArrayList<>()).add(e));
            }
        } else {
            return Optional.empty();
        }

        SeriesEpisodes result = new SeriesEpisodes(seriesId, seasons);
        return result.isEmpty() ? Optional.empty() : Optional.of(result);
    }

    private Optional<Episode> episode(JsonNode node, String season) {
        String id = text(node, "id");
        if (id == null) {
            return Optional.empty();
        }
        return Optional.of(new Episode(
                id,
                season,
                text(node, "episode_num"),
                text(node, "title"),
                text(node, "container_extension"),
                text(node, "added"),
                size(node)));
    }

    private static void requireList(JsonNode reply, String action) {
        if (reply == null || !reply.isArray()) {
            throw new InvalidCatalogFormatException(action + " data is not in the expected format");
        }
    }

    private static Long size(JsonNode node) {
        String value = text(node, "size");
        if (isBlank(value)) {
            return null;
        }
        try {
            long size = Long.parseLong(value.trim());
            return size >= 0 ? size : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }

    private static String orDefault(String value, String fallback) {
        return value != null ? value : fallback;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
