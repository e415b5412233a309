package com.iptv.gateway.core.filter;

import com.iptv.gateway.core.model.FilterSpec;

import java.util.List;
import java.util.Locale;

/**
 * Inclusion test for playlist streams, built once per request from a {@link FilterSpec}.
 *
 * <p>Both the raw category name and the content-kind-prefixed group title are checked against
 * every pattern. With wanted patterns a stream is included iff one of them matches; otherwise
 * with unwanted patterns it is included iff none matches; with neither everything is included.
 */
public class GroupFilter {

    private final List<GroupPattern> wanted;
    private final List<GroupPattern> unwanted;

    public GroupFilter(FilterSpec spec) {
        this.wanted = spec.wanted().stream().map(GroupPattern::compile).toList();
        this.unwanted = spec.unwanted().stream().map(GroupPattern::compile).toList();
    }

    public boolean includes(String categoryName, String groupTitle) {
        if (!wanted.isEmpty()) {
            return anyMatches(wanted, categoryName, groupTitle);
        }
        if (!unwanted.isEmpty()) {
            return !anyMatches(unwanted, categoryName, groupTitle);
        }
        return true;
    }

    public boolean isActive() {
        return !wanted.isEmpty() || !unwanted.isEmpty();
    }

    private static boolean anyMatches(List<GroupPattern> patterns, String categoryName, String groupTitle) {
        String category = categoryName.toLowerCase(Locale.ROOT);
        String group = groupTitle.toLowerCase(Locale.ROOT);
        for (GroupPattern pattern : patterns) {
            if (pattern.matchesLowered(category) || pattern.matchesLowered(group)) {
                return true;
            }
        }
        return false;
    }
}
