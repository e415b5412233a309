package com.iptv.gateway.infrastructure.upstream;

import com.iptv.gateway.application.port.MediaUpstreamPort;
import com.iptv.gateway.core.exception.ProxyFailureException;
import com.iptv.gateway.core.exception.ProxyUpstreamTimeoutException;
import com.iptv.gateway.core.proxy.UpstreamMedia;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;

/**
 * Opens proxied URLs over OkHttp and hands back the unread body. Implements {@link MediaUpstreamPort}.
 * No overall call deadline is set, so live streams may run indefinitely.
 */
@Component
public class OkHttpMediaAdapter implements MediaUpstreamPort {

    private final OkHttpClient httpClient;

    public OkHttpMediaAdapter(OkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public UpstreamMedia open(String url, Duration readTimeout) {
        HttpUrl httpUrl = HttpUrl.parse(url);
        if (httpUrl == null) {
            throw new ProxyFailureException("Invalid upstream URL: " + url);
        }
        OkHttpClient client = httpClient.newBuilder()
                .readTimeout(readTimeout)
                .build();
        Request request = new Request.Builder()
                .url(httpUrl)
                .header("Connection", "keep-alive")
                .build();

        Response response;
        try {
            response = client.newCall(request).execute();
        } catch (InterruptedIOException e) {
            throw new ProxyUpstreamTimeoutException("Timed out fetching " + url, e);
        } catch (IOException e) {
            throw new ProxyFailureException("Failed to fetch " + url + ": " + e.getMessage(), e);
        }

        ResponseBody body = response.body();
        if (body == null) {
            response.close();
            throw new ProxyFailureException("Upstream response without body: " + url);
        }
        return new UpstreamMedia(
                response.code(),
                response.header("Content-Type"),
                response.header("Content-Length"),
                response.header("Transfer-Encoding"),
                body.byteStream(),
                response);
    }
}
