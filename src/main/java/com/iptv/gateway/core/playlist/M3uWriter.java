package com.iptv.gateway.core.playlist;

import com.iptv.gateway.core.model.PlaylistRecord;

import java.util.List;

/**
 * Renders playlist records as an extended M3U document.
 */
public class M3uWriter {

    public static final String HEADER = "#EXTM3U";

    public String write(List<PlaylistRecord> records) {
        StringBuilder sb = new StringBuilder(64 + records.size() * 160);
        sb.append(HEADER).append('\n');
        for (PlaylistRecord record : records) {
            appendRecord(sb, record);
        }
        return sb.toString();
    }

    private void appendRecord(StringBuilder sb, PlaylistRecord record) {
        sb.append("#EXTINF:0 ");
        appendTag(sb, "tvg-name", record.tvgName());
        sb.append(' ');
        appendTag(sb, "group-title", record.groupTitle());
        if (record.logoUrl() != null && !record.logoUrl().isEmpty()) {
            sb.append(' ');
            appendTag(sb, "tvg-logo", record.logoUrl());
        }
        for (PlaylistRecord.Tag tag : record.extraTags()) {
            sb.append(' ');
            appendTag(sb, tag.key(), tag.value());
        }
        sb.append(',').append(record.displayName()).append('\n');
        if (record.sizeBytes() != null) {
            sb.append("#EXTBYT:").append(record.sizeBytes()).append('\n');
        }
        sb.append(record.mediaUrl()).append('\n');
    }

    private void appendTag(StringBuilder sb, String key, String value) {
        sb.append(key).append("=\"").append(value.replace('"', '\'')).append('"');
    }
}
