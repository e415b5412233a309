package com.iptv.gateway.core.filter;

/**
 * Shell-style wildcard matching over string ranges: {@code *} matches any run of characters,
 * {@code ?} matches exactly one. Every other character matches itself.
 */
final class Glob {

    private Glob() {
    }

    static boolean matches(String pattern, int patternStart, int patternEnd,
                           String text, int textStart, int textEnd) {
        int p = patternStart;
        int t = textStart;
        int starP = -1;
        int starT = -1;

        while (t < textEnd) {
            if (p < patternEnd) {
                char pc = pattern.charAt(p);
                if (pc == '*') {
                    starP = p++;
                    starT = t;
                    continue;
                }
                if (pc == '?' || pc == text.charAt(t)) {
                    p++;
                    t++;
                    continue;
                }
            }
            if (starP < 0) {
                return false;
            }
            // let the last star absorb one more character and retry
            p = starP + 1;
            t = ++starT;
        }

        while (p < patternEnd && pattern.charAt(p) == '*') {
            p++;
        }
        return p == patternEnd;
    }
}
