package com.iptv.gateway.core.model;

import java.util.Arrays;
import java.util.List;

/**
 * Group include/exclude patterns of one request.
 * When {@code wanted} is non-empty, {@code unwanted} is ignored.
 */
public record FilterSpec(
        List<String> wanted,
        List<String> unwanted
) {

    public static final FilterSpec NONE = new FilterSpec(List.of(), List.of());

    public FilterSpec {
        wanted = wanted == null ? List.of() : List.copyOf(wanted);
        unwanted = unwanted == null ? List.of() : List.copyOf(unwanted);
    }

    public static FilterSpec fromCommaSeparated(String wanted, String unwanted) {
        return new FilterSpec(parseGroupList(wanted), parseGroupList(unwanted));
    }

    /**
     * Splits a comma-separated group list, trimming entries and dropping blank ones.
     */
    public static List<String> parseGroupList(String groups) {
        if (groups == null || groups.isBlank()) {
            return List.of();
        }
        return Arrays.stream(groups.split(","))
                .map(String::trim)
                .filter(group -> !group.isEmpty())
                .toList();
    }
}
