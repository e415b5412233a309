package com.iptv.gateway.infrastructure.api.controller;

import com.iptv.gateway.application.service.CatalogService;
import com.iptv.gateway.application.service.GuideService;
import com.iptv.gateway.application.service.PlaylistService;
import com.iptv.gateway.config.GatewayProperties;
import com.iptv.gateway.core.exception.MissingParametersException;
import com.iptv.gateway.core.model.FilterSpec;
import com.iptv.gateway.core.model.PlaylistOptions;
import com.iptv.gateway.core.model.XtreamCredentials;
import com.iptv.gateway.infrastructure.api.dto.CategoryResponse;
import com.iptv.gateway.infrastructure.api.dto.PlaylistRequest;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * REST controller for playlist, category and guide generation.
 */
@RestController
public class PlaylistController {

    private static final Logger log = LoggerFactory.getLogger(PlaylistController.class);

    static final MediaType M3U = new MediaType("audio", "x-mpegurl", StandardCharsets.UTF_8);
    static final MediaType XML = new MediaType(MediaType.APPLICATION_XML, StandardCharsets.UTF_8);

    private final PlaylistService playlistService;
    private final CatalogService catalogService;
    private final GuideService guideService;
    private final String defaultProxyUrl;

    public PlaylistController(PlaylistService playlistService,
                              CatalogService catalogService,
                              GuideService guideService,
                              GatewayProperties properties) {
        this.playlistService = playlistService;
        this.catalogService = catalogService;
        this.guideService = guideService;
        this.defaultProxyUrl = properties.getDefaultProxyUrl();
    }

    @GetMapping("/m3u")
    public ResponseEntity<String> getPlaylist(
            @RequestParam(required = false) String url,
            @RequestParam(required = false) String username,
            @RequestParam(required = false) String password,
            @RequestParam(name = "proxy_url", required = false) String proxyUrl,
            @RequestParam(name = "wanted_groups", required = false) String wantedGroups,
            @RequestParam(name = "unwanted_groups", required = false) String unwantedGroups,
            @RequestParam(name = "nostreamproxy", required = false) String noStreamProxy,
            @RequestParam(name = "include_vod", required = false) String includeVod,
            @RequestParam(name = "include_channel_id", required = false) String includeChannelId,
            @RequestParam(name = "channel_id_tag", required = false) String channelIdTag,
            HttpServletRequest request
    ) {
        log.info("Processing GET request for M3U generation");
        return playlist(new PlaylistRequest(url, username, password, proxyUrl, wantedGroups, unwantedGroups,
                noStreamProxy, includeVod, includeChannelId, channelIdTag), request);
    }

    @PostMapping(value = "/m3u", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> postPlaylist(
            @Valid @RequestBody PlaylistRequest body,
            HttpServletRequest request
    ) {
        log.info("Processing POST request for M3U generation");
        return playlist(body, request);
    }

    @GetMapping("/categories")
    public ResponseEntity<List<CategoryResponse>> getCategories(
            @RequestParam(required = false) String url,
            @RequestParam(required = false) String username,
            @RequestParam(required = false) String password,
            @RequestParam(name = "include_vod", required = false) String includeVod
    ) {
        XtreamCredentials credentials = credentials(url, username, password);
        List<CategoryResponse> categories = catalogService.listCategories(credentials, isTrue(includeVod)).stream()
                .map(category -> new CategoryResponse(
                        category.getId(),
                        category.getName(),
                        category.getParentId(),
                        category.getContentKind().wireName()))
                .toList();
        return ResponseEntity.ok(categories);
    }

    @GetMapping("/xmltv")
    public ResponseEntity<String> getGuide(
            @RequestParam(required = false) String url,
            @RequestParam(required = false) String username,
            @RequestParam(required = false) String password,
            @RequestParam(name = "proxy_url", required = false) String proxyUrl,
            @RequestParam(name = "nostreamproxy", required = false) String noStreamProxy,
            HttpServletRequest request
    ) {
        XtreamCredentials credentials = credentials(url, username, password);
        String guide = guideService.generate(credentials, proxyBaseUrl(proxyUrl, request), !isTrue(noStreamProxy));
        return ResponseEntity.ok()
                .contentType(XML)
                .header(HttpHeaders.CONTENT_DISPOSITION, attachment("guide.xml"))
                .body(guide);
    }

    private ResponseEntity<String> playlist(PlaylistRequest body, HttpServletRequest request) {
        XtreamCredentials credentials = credentials(body.url(), body.username(), body.password());
        PlaylistService.PlaylistCommand command = new PlaylistService.PlaylistCommand(
                credentials,
                proxyBaseUrl(body.proxyUrl(), request),
                FilterSpec.fromCommaSeparated(body.wantedGroups(), body.unwantedGroups()),
                !isTrue(body.noStreamProxy()),
                isTrue(body.includeVod()),
                isTrue(body.includeChannelId()),
                body.channelIdTag() == null ? PlaylistOptions.DEFAULT_CHANNEL_ID_TAG : body.channelIdTag());

        PlaylistService.PlaylistResult result = playlistService.generate(command);
        return ResponseEntity.ok()
                .contentType(M3U)
                .header(HttpHeaders.CONTENT_DISPOSITION, attachment(result.filename()))
                .header(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "*")
                .body(result.content());
    }

    private static XtreamCredentials credentials(String url, String username, String password) {
        if (isBlank(url) || isBlank(username) || isBlank(password)) {
            throw new MissingParametersException("Required parameters: url, username, and password");
        }
        return new XtreamCredentials(url.trim(), username, password);
    }

    /**
     * The caller's proxy URL, else the configured default, else this request's own origin.
     */
    private String proxyBaseUrl(String requested, HttpServletRequest request) {
        if (!isBlank(requested)) {
            return requested.trim();
        }
        if (!isBlank(defaultProxyUrl)) {
            return defaultProxyUrl.trim();
        }
        return ServletUriComponentsBuilder.fromContextPath(request).build().toUriString();
    }

    private static String attachment(String filename) {
        return ContentDisposition.attachment().filename(filename).build().toString();
    }

    private static boolean isTrue(String flag) {
        return flag != null && flag.trim().equalsIgnoreCase("true");
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
