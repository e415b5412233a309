package com.iptv.gateway.core.model;

import java.util.List;

/**
 * One playlist entry: a metadata line and a URL line in the output document.
 *
 * @param tvgName     value of the {@code tvg-name} tag
 * @param displayName name after the comma of the metadata line
 * @param groupTitle  value of the {@code group-title} tag
 * @param logoUrl     logo URL, direct or proxied, or null
 * @param mediaUrl    media URL, direct or proxied
 * @param extraTags   further tags in output order
 * @param sizeBytes   media size for the {@code #EXTBYT} directive, or null
 */
public record PlaylistRecord(
        String tvgName,
        String displayName,
        String groupTitle,
        String logoUrl,
        String mediaUrl,
        List<Tag> extraTags,
        Long sizeBytes
) {

    public PlaylistRecord {
        extraTags = List.copyOf(extraTags);
    }

    public record Tag(String key, String value) {}
}
