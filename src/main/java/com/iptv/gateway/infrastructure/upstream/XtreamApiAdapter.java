package com.iptv.gateway.infrastructure.upstream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.iptv.gateway.application.port.XtreamApiPort;
import com.iptv.gateway.core.exception.UpstreamTransportException;
import com.iptv.gateway.core.model.AccountInfo;
import com.iptv.gateway.core.model.CatalogEndpoint;
import com.iptv.gateway.core.model.Category;
import com.iptv.gateway.core.model.SeriesEpisodes;
import com.iptv.gateway.core.model.StreamEntry;
import com.iptv.gateway.core.model.XtreamCredentials;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Upstream catalog API calls over OkHttp. Implements {@link XtreamApiPort}.
 * Each call gets its own time budget; JSON bodies are parsed straight from the response stream.
 */
@Component
public class XtreamApiAdapter implements XtreamApiPort {

    private static final Logger log = LoggerFactory.getLogger(XtreamApiAdapter.class);

    static final String PLAYER_API = "player_api.php";
    static final String GUIDE_API = "xmltv.php";
    static final Duration AUTH_TIMEOUT = Duration.ofSeconds(10);

    private static final String ACCEPT = "application/json,text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final XtreamResponseParser parser;

    public XtreamApiAdapter(OkHttpClient httpClient, ObjectMapper objectMapper, XtreamResponseParser parser) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.parser = parser;
    }

    @Override
    public AccountInfo authenticate(XtreamCredentials credentials) {
        JsonNode reply = getJson(playerApiUrl(credentials, null).build(), AUTH_TIMEOUT, "account");
        return parser.account(reply, credentials);
    }

    @Override
    public List<Category> fetchCategories(XtreamCredentials credentials, CatalogEndpoint endpoint) {
        HttpUrl url = playerApiUrl(credentials, endpoint.action()).build();
        return parser.categories(getJson(url, endpoint.timeout(), endpoint.action()),
                endpoint.contentKind(), endpoint.action());
    }

    @Override
    public List<StreamEntry> fetchStreams(XtreamCredentials credentials, CatalogEndpoint endpoint) {
        HttpUrl url = playerApiUrl(credentials, endpoint.action()).build();
        return parser.streams(getJson(url, endpoint.timeout(), endpoint.action()),
                endpoint.contentKind(), endpoint.action());
    }

    @Override
    public Optional<SeriesEpisodes> fetchSeriesEpisodes(XtreamCredentials credentials, String seriesId,
                                                        Duration timeout) {
        HttpUrl url = playerApiUrl(credentials, "get_series_info")
                .addQueryParameter("series_id", seriesId)
                .build();
        return parser.seriesEpisodes(getJson(url, timeout, "get_series_info"), seriesId);
    }

    @Override
    public String fetchGuide(XtreamCredentials credentials, Duration timeout) {
        HttpUrl url = baseUrl(credentials).newBuilder()
                .addPathSegment(GUIDE_API)
                .addQueryParameter("username", credentials.username())
                .addQueryParameter("password", credentials.password())
                .build();
        try (Response response = execute(url, timeout, "xmltv")) {
            ResponseBody body = response.body();
            return body == null ? "" : body.string();
        } catch (IOException e) {
            throw transportFailure("xmltv", e);
        }
    }

    private JsonNode getJson(HttpUrl url, Duration timeout, String label) {
        try (Response response = execute(url, timeout, label)) {
            ResponseBody body = response.body();
            if (body == null) {
                return MissingNode.getInstance();
            }
            try {
                JsonNode node = objectMapper.readTree(body.byteStream());
                return node == null ? MissingNode.getInstance() : node;
            } catch (JsonProcessingException e) {
                log.warn("Upstream {} reply from {} is not JSON: {}", label, url.host(), e.getOriginalMessage());
                return MissingNode.getInstance();
            }
        } catch (IOException e) {
            throw transportFailure(label, e);
        }
    }

    private Response execute(HttpUrl url, Duration timeout, String label) throws IOException {
        log.debug("Requesting {} from host {}", label, url.host());
        OkHttpClient client = httpClient.newBuilder()
                .callTimeout(timeout)
                .readTimeout(timeout)
                .build();
        Request request = new Request.Builder()
                .url(url)
                .header("Accept", ACCEPT)
                .header("Accept-Language", "en-US,en;q=0.5")
                .build();
        Response response = client.newCall(request).execute();
        if (!response.isSuccessful()) {
            int code = response.code();
            response.close();
            throw new UpstreamTransportException("Upstream answered " + code + " for " + label);
        }
        return response;
    }

    private HttpUrl.Builder playerApiUrl(XtreamCredentials credentials, String action) {
        HttpUrl.Builder builder = baseUrl(credentials).newBuilder()
                .addPathSegment(PLAYER_API)
                .addQueryParameter("username", credentials.username())
                .addQueryParameter("password", credentials.password());
        if (action != null) {
            builder.addQueryParameter("action", action);
        }
        return builder;
    }

    private static HttpUrl baseUrl(XtreamCredentials credentials) {
        HttpUrl base = HttpUrl.parse(credentials.baseUrl());
        if (base == null) {
            throw new UpstreamTransportException("Invalid upstream URL: " + credentials.baseUrl());
        }
        return base;
    }

    private static UpstreamTransportException transportFailure(String label, IOException e) {
        log.warn("Request for {} failed: {}", label, e.toString());
        if (e instanceof SSLException) {
            return new UpstreamTransportException("SSL error while fetching " + label + ": " + e.getMessage(), e);
        }
        return new UpstreamTransportException("Failed to fetch " + label + ": " + e.getMessage(), e);
    }
}
