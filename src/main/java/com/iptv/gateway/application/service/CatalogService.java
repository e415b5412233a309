package com.iptv.gateway.application.service;

import com.iptv.gateway.application.port.XtreamApiPort;
import com.iptv.gateway.config.GatewayProperties;
import com.iptv.gateway.core.exception.InvalidCatalogFormatException;
import com.iptv.gateway.core.exception.UpstreamTransportException;
import com.iptv.gateway.core.model.Catalog;
import com.iptv.gateway.core.model.CatalogEndpoint;
import com.iptv.gateway.core.model.Category;
import com.iptv.gateway.core.model.StreamEntry;
import com.iptv.gateway.core.model.XtreamCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Fetches the upstream catalog, one concurrent request per endpoint.
 *
 * <p>Every endpoint fails on its own: a failed optional endpoint contributes nothing, while a
 * failed or malformed mandatory endpoint (live categories, live streams) fails the whole fetch.
 * All requests run to completion or to their own timeout; none cancels a sibling.
 */
@Service
public class CatalogService {

    private static final Logger log = LoggerFactory.getLogger(CatalogService.class);

    private final XtreamApiPort xtreamApiPort;
    private final int concurrency;

    public CatalogService(XtreamApiPort xtreamApiPort, GatewayProperties properties) {
        this.xtreamApiPort = xtreamApiPort;
        this.concurrency = properties.getCatalog().getConcurrency();
    }

    /**
     * Result of one endpoint request. Exactly one of the lists or the failure is meaningful.
     */
    record EndpointResult(
            CatalogEndpoint endpoint,
            List<Category> categories,
            List<StreamEntry> streams,
            RuntimeException failure
    ) {

        static EndpointResult failed(CatalogEndpoint endpoint, RuntimeException failure) {
            return new EndpointResult(endpoint, List.of(), List.of(), failure);
        }

        boolean isFailed() {
            return failure != null;
        }
    }

    /**
     * Validates the credentials and lists the categories, without the large stream lists.
     *
     * @param credentials the upstream location and account
     * @param includeVod  whether VOD and series categories are included
     * @return categories tagged with their content kind
     */
    public List<Category> listCategories(XtreamCredentials credentials, boolean includeVod) {
        xtreamApiPort.authenticate(credentials);
        return fetch(credentials, includeVod, false).categories();
    }

    /**
     * Fetches categories and streams concurrently.
     *
     * @param credentials          the upstream location and account
     * @param includeVod           whether VOD and series categories are fetched
     * @param includeSeriesStreams whether VOD and series stream lists are fetched as well
     * @return the aggregated catalog; live entries first, then VOD, then series
     */
    public Catalog fetch(XtreamCredentials credentials, boolean includeVod, boolean includeSeriesStreams) {
        List<CatalogEndpoint> endpoints = CatalogEndpoint.plan(includeVod, includeSeriesStreams);
        log.info("Starting concurrent fetch of {} catalog endpoints", endpoints.size());

        Map<CatalogEndpoint, EndpointResult> results = fetchAll(credentials, endpoints);

        for (CatalogEndpoint endpoint : endpoints) {
            if (endpoint.isMandatory()) {
                requireSuccess(results.get(endpoint));
            }
        }

        List<Category> categories = new ArrayList<>();
        List<StreamEntry> streams = new ArrayList<>();
        for (CatalogEndpoint endpoint : endpoints) {
            EndpointResult result = results.get(endpoint);
            if (result.isFailed()) {
                log.warn("Skipping {}: {}", endpoint, result.failure().getMessage());
                continue;
            }
            categories.addAll(result.categories());
            streams.addAll(result.streams());
        }

        log.info("Catalog fetch complete: {} categories and {} streams", categories.size(), streams.size());
        return new Catalog(categories, streams);
    }

    private Map<CatalogEndpoint, EndpointResult> fetchAll(XtreamCredentials credentials,
                                                          List<CatalogEndpoint> endpoints) {
        ExecutorService executor = Executors.newFixedThreadPool(
                Math.max(1, Math.min(concurrency, endpoints.size())),
                new CustomizableThreadFactory("catalog-fetch-"));
        try {
            Map<CatalogEndpoint, CompletableFuture<EndpointResult>> futures = new EnumMap<>(CatalogEndpoint.class);
            for (CatalogEndpoint endpoint : endpoints) {
                futures.put(endpoint, CompletableFuture.supplyAsync(() -> fetchEndpoint(credentials, endpoint), executor));
            }
            Map<CatalogEndpoint, EndpointResult> results = new EnumMap<>(CatalogEndpoint.class);
            futures.forEach((endpoint, future) -> results.put(endpoint, future.join()));
            return results;
        } finally {
            executor.shutdown();
        }
    }

    private EndpointResult fetchEndpoint(XtreamCredentials credentials, CatalogEndpoint endpoint) {
        long start = System.nanoTime();
        try {
            EndpointResult result = switch (endpoint.listing()) {
                case CATEGORIES -> new EndpointResult(endpoint,
                        xtreamApiPort.fetchCategories(credentials, endpoint), List.of(), null);
                case STREAMS -> new EndpointResult(endpoint,
                        List.of(), xtreamApiPort.fetchStreams(credentials, endpoint), null);
            };
            log.info("Completed {} in {} ms - got {} items", endpoint, elapsedMillis(start),
                    result.categories().size() + result.streams().size());
            return result;
        } catch (RuntimeException e) {
            log.warn("Failed to fetch {} after {} ms: {}", endpoint, elapsedMillis(start), e.getMessage());
            return EndpointResult.failed(endpoint, e);
        }
    }

    private static void requireSuccess(EndpointResult result) {
        if (!result.isFailed()) {
            return;
        }
        RuntimeException failure = result.failure();
        if (failure instanceof InvalidCatalogFormatException || failure instanceof UpstreamTransportException) {
            throw failure;
        }
        throw new UpstreamTransportException("Failed to fetch " + result.endpoint().action(), failure);
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
