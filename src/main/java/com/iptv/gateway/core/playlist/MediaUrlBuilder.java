package com.iptv.gateway.core.playlist;

import com.iptv.gateway.core.model.AccountInfo;
import com.iptv.gateway.core.model.ContentKind;

/**
 * Builds direct media server URLs of the form {@code {server}/{kind}/{username}/{password}/{id}.{ext}}.
 */
public class MediaUrlBuilder {

    static final String DEFAULT_CONTAINER = "mp4";
    static final String LIVE_CONTAINER = "ts";

    private final AccountInfo account;

    public MediaUrlBuilder(AccountInfo account) {
        this.account = account;
    }

    public String build(ContentKind kind, String id, String containerExtension) {
        String extension = switch (kind) {
            case LIVE -> LIVE_CONTAINER;
            case VOD, SERIES -> isBlank(containerExtension) ? DEFAULT_CONTAINER : containerExtension;
        };
        return account.serverUrl() + "/" + kind.mediaPathSegment() + "/"
                + account.username() + "/" + account.password() + "/" + id + "." + extension;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
