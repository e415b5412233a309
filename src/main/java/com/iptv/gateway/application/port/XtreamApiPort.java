package com.iptv.gateway.application.port;

import com.iptv.gateway.core.model.AccountInfo;
import com.iptv.gateway.core.model.CatalogEndpoint;
import com.iptv.gateway.core.model.Category;
import com.iptv.gateway.core.model.SeriesEpisodes;
import com.iptv.gateway.core.model.StreamEntry;
import com.iptv.gateway.core.model.XtreamCredentials;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Port to the upstream catalog API ({@code player_api.php} and {@code xmltv.php}).
 * This abstraction keeps the application layer independent of the HTTP client and JSON handling.
 *
 * <p>Transport failures and HTTP errors surface as
 * {@link com.iptv.gateway.core.exception.UpstreamTransportException}.
 */
public interface XtreamApiPort {

    /**
     * Checks the credentials and reads the media server location.
     *
     * @param credentials the upstream location and account
     * @return the account as echoed by the upstream
     * @throws com.iptv.gateway.core.exception.InvalidCredentialsException    if the account is rejected
     * @throws com.iptv.gateway.core.exception.AuthResponseMalformedException if the reply cannot be understood
     */
    AccountInfo authenticate(XtreamCredentials credentials);

    /**
     * Fetches a category list, every category tagged with the endpoint's content kind.
     *
     * @throws com.iptv.gateway.core.exception.InvalidCatalogFormatException if the reply is not a list
     */
    List<Category> fetchCategories(XtreamCredentials credentials, CatalogEndpoint endpoint);

    /**
     * Fetches a stream list, every entry tagged with the endpoint's content kind.
     *
     * @throws com.iptv.gateway.core.exception.InvalidCatalogFormatException if the reply is not a list
     */
    List<StreamEntry> fetchStreams(XtreamCredentials credentials, CatalogEndpoint endpoint);

    /**
     * Fetches the episode listing of one series.
     *
     * @return the episodes, or empty when the reply carries none
     */
    Optional<SeriesEpisodes> fetchSeriesEpisodes(XtreamCredentials credentials, String seriesId, Duration timeout);

    /**
     * Fetches the XMLTV guide document as text.
     */
    String fetchGuide(XtreamCredentials credentials, Duration timeout);
}
