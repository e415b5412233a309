package com.iptv.gateway.application.service;

import com.iptv.gateway.application.port.XtreamApiPort;
import com.iptv.gateway.config.GatewayProperties;
import com.iptv.gateway.core.model.SeriesEpisodes;
import com.iptv.gateway.core.model.XtreamCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Resolves episode listings for already-filtered series with bounded concurrency.
 * A series whose lookup fails or returns no episodes is left out of the result.
 */
@Service
public class EpisodeResolverService {

    private static final Logger log = LoggerFactory.getLogger(EpisodeResolverService.class);

    private static final int PROGRESS_INTERVAL = 50;

    private final XtreamApiPort xtreamApiPort;
    private final int concurrency;
    private final Duration timeout;

    public EpisodeResolverService(XtreamApiPort xtreamApiPort, GatewayProperties properties) {
        this.xtreamApiPort = xtreamApiPort;
        this.concurrency = properties.getEpisodes().getConcurrency();
        this.timeout = properties.getEpisodes().getTimeout();
    }

    /**
     * @param credentials the upstream location and account
     * @param seriesIds   ids of series that passed the group filter
     * @return episodes by series id, in the order of {@code seriesIds}
     */
    public Map<String, SeriesEpisodes> resolve(XtreamCredentials credentials, List<String> seriesIds) {
        List<String> distinctIds = seriesIds.stream().distinct().toList();
        if (distinctIds.isEmpty()) {
            return Map.of();
        }
        log.info("Fetching episodes for {} series", distinctIds.size());

        ExecutorService executor = Executors.newFixedThreadPool(
                Math.max(1, Math.min(concurrency, distinctIds.size())),
                new CustomizableThreadFactory("episode-fetch-"));
        AtomicInteger completed = new AtomicInteger();
        try {
            Map<String, CompletableFuture<Optional<SeriesEpisodes>>> futures = new LinkedHashMap<>();
            for (String seriesId : distinctIds) {
                futures.put(seriesId, CompletableFuture.supplyAsync(() -> {
                    Optional<SeriesEpisodes> episodes = fetchQuietly(credentials, seriesId);
                    int done = completed.incrementAndGet();
                    if (done % PROGRESS_INTERVAL == 0) {
                        log.info("Fetched episodes for {}/{} series", done, distinctIds.size());
                    }
                    return episodes;
                }, executor));
            }

            Map<String, SeriesEpisodes> resolved = new LinkedHashMap<>();
            futures.forEach((seriesId, future) -> future.join().ifPresent(e -> resolved.put(seriesId, e)));
            log.info("Resolved episodes for {} of {} series", resolved.size(), distinctIds.size());
            return resolved;
        } finally {
            executor.shutdown();
        }
    }

    private Optional<SeriesEpisodes> fetchQuietly(XtreamCredentials credentials, String seriesId) {
        long start = System.nanoTime();
        try {
            Optional<SeriesEpisodes> episodes = xtreamApiPort.fetchSeriesEpisodes(credentials, seriesId, timeout)
                    .filter(e -> !e.isEmpty());
            if (episodes.isEmpty()) {
                log.warn("No episodes found for series {}", seriesId);
            } else {
                log.debug("Fetched episodes for series {} in {} ms", seriesId, (System.nanoTime() - start) / 1_000_000);
            }
            return episodes;
        } catch (RuntimeException e) {
            log.warn("Failed to fetch episodes for series {}: {}", seriesId, e.getMessage());
            return Optional.empty();
        }
    }
}
