package com.iptv.gateway.core.filter;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * A group filter pattern, lower-cased and classified once so it can be matched
 * against every stream of a request without further allocation.
 *
 * <p>Matching rules, all case-insensitive:
 * <ul>
 *     <li>pattern containing a space: both sides are split into whitespace-delimited tokens,
 *     the label needs at least as many tokens as the pattern and every pattern token must match
 *     the label token at the same position (glob if the token has a wildcard, substring otherwise);</li>
 *     <li>pattern containing {@code *} or {@code ?}: glob match against the whole label;</li>
 *     <li>anything else: substring containment.</li>
 * </ul>
 */
public final class GroupPattern {

    private enum Mode { TOKENS, GLOB, SUBSTRING }

    private final String source;
    private final String lowered;
    private final Mode mode;
    private final String[] tokens;
    private final boolean[] tokenIsGlob;

    private GroupPattern(String source) {
        this.source = source;
        this.lowered = source.toLowerCase(Locale.ROOT);
        if (lowered.indexOf(' ') >= 0) {
            this.mode = Mode.TOKENS;
            this.tokens = splitTokens(lowered);
            this.tokenIsGlob = new boolean[tokens.length];
            for (int i = 0; i < tokens.length; i++) {
                tokenIsGlob[i] = hasWildcard(tokens[i]);
            }
        } else {
            this.mode = hasWildcard(lowered) ? Mode.GLOB : Mode.SUBSTRING;
            this.tokens = new String[0];
            this.tokenIsGlob = new boolean[0];
        }
    }

    public static GroupPattern compile(String pattern) {
        return new GroupPattern(pattern);
    }

    /**
     * One-off check, lower-casing both sides.
     */
    public static boolean matches(String label, String pattern) {
        return compile(pattern).matches(label);
    }

    public boolean matches(String label) {
        return matchesLowered(label.toLowerCase(Locale.ROOT));
    }

    /**
     * Matches a label that the caller has already lower-cased with {@link Locale#ROOT}.
     */
    public boolean matchesLowered(String label) {
        switch (mode) {
            case SUBSTRING:
                return label.contains(lowered);
            case GLOB:
                return Glob.matches(lowered, 0, lowered.length(), label, 0, label.length());
            default:
                return matchesTokens(label);
        }
    }

    public String source() {
        return source;
    }

    private boolean matchesTokens(String label) {
        int pos = 0;
        int length = label.length();
        for (int i = 0; i < tokens.length; i++) {
            while (pos < length && Character.isWhitespace(label.charAt(pos))) {
                pos++;
            }
            if (pos >= length) {
                // label has fewer tokens than the pattern
                return false;
            }
            int end = pos;
            while (end < length && !Character.isWhitespace(label.charAt(end))) {
                end++;
            }
            String token = tokens[i];
            boolean ok = tokenIsGlob[i]
                    ? Glob.matches(token, 0, token.length(), label, pos, end)
                    : containsWithin(label, pos, end, token);
            if (!ok) {
                return false;
            }
            pos = end;
        }
        return true;
    }

    private static boolean containsWithin(String text, int from, int to, String needle) {
        int last = to - needle.length();
        for (int i = from; i <= last; i++) {
            if (text.regionMatches(i, needle, 0, needle.length())) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasWildcard(String value) {
        return value.indexOf('*') >= 0 || value.indexOf('?') >= 0;
    }

    private static String[] splitTokens(String value) {
        List<String> parts = new ArrayList<>();
        int pos = 0;
        int length = value.length();
        while (pos < length) {
            while (pos < length && Character.isWhitespace(value.charAt(pos))) {
                pos++;
            }
            int end = pos;
            while (end < length && !Character.isWhitespace(value.charAt(end))) {
                end++;
            }
            if (end > pos) {
                parts.add(value.substring(pos, end));
            }
            pos = end;
        }
        return parts.toArray(new String[0]);
    }

    @Override
    public String toString() {
        return source;
    }
}
