package com.iptv.gateway.application.service;

import com.iptv.gateway.application.port.XtreamApiPort;
import com.iptv.gateway.core.model.AccountInfo;
import com.iptv.gateway.core.model.Catalog;
import com.iptv.gateway.core.model.FilterSpec;
import com.iptv.gateway.core.model.PlaylistOptions;
import com.iptv.gateway.core.model.XtreamCredentials;
import com.iptv.gateway.core.playlist.PlaylistSynthesizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Service for playlist generation: validates the account, fetches the catalog,
 * resolves episodes of the series that pass the filter and renders the playlist.
 */
@Service
public class PlaylistService {

    private static final Logger log = LoggerFactory.getLogger(PlaylistService.class);

    private static final int LARGE_FILTER_LIST = 20;

    private final XtreamApiPort xtreamApiPort;
    private final CatalogService catalogService;
    private final EpisodeResolverService episodeResolverService;
    private final PlaylistSynthesizer synthesizer = new PlaylistSynthesizer();

    public PlaylistService(XtreamApiPort xtreamApiPort,
                           CatalogService catalogService,
                           EpisodeResolverService episodeResolverService) {
        this.xtreamApiPort = xtreamApiPort;
        this.catalogService = catalogService;
        this.episodeResolverService = episodeResolverService;
    }

    /**
     * Command record carrying everything a playlist request asks for.
     */
    public record PlaylistCommand(
            XtreamCredentials credentials,
            String proxyBaseUrl,
            FilterSpec filter,
            boolean proxyEnabled,
            boolean includeVod,
            boolean includeChannelId,
            String channelIdTag
    ) {}

    /**
     * Result record containing the rendered playlist and its download name.
     */
    public record PlaylistResult(
            String content,
            String filename
    ) {}

    /**
     * Generates the playlist. Credential and mandatory catalog failures abort the request;
     * optional endpoints and single series degrade the result instead.
     *
     * @param command the playlist request
     * @return the playlist text and file name
     */
    public PlaylistResult generate(PlaylistCommand command) {
        FilterSpec filter = command.filter();
        log.info("Generating playlist: includeVod={}, wanted={}, unwanted={}",
                command.includeVod(), describe(filter.wanted().size()), describe(filter.unwanted().size()));
        if (filter.wanted().size() + filter.unwanted().size() > LARGE_FILTER_LIST) {
            log.warn("Large filter list ({} patterns) - generation will be slower",
                    filter.wanted().size() + filter.unwanted().size());
        }

        XtreamCredentials credentials = command.credentials();
        AccountInfo account = xtreamApiPort.authenticate(credentials);
        Catalog catalog = catalogService.fetch(credentials, command.includeVod(), true);

        PlaylistOptions options = new PlaylistOptions(
                account,
                command.proxyBaseUrl(),
                command.proxyEnabled(),
                command.includeVod(),
                command.includeChannelId(),
                command.channelIdTag());

        String content = synthesizer.synthesize(catalog, filter, options,
                seriesIds -> episodeResolverService.resolve(credentials, seriesIds));
        String filename = command.includeVod() ? "FullPlaylist.m3u" : "LiveStream.m3u";
        return new PlaylistResult(content, filename);
    }

    private static String describe(int patternCount) {
        return patternCount + " patterns";
    }
}
