package com.iptv.gateway.core.guide;

import com.iptv.gateway.core.playlist.ProxyUrlRewriter;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites {@code <icon src="...">} values of an XMLTV guide to proxied image URLs.
 * All other XML is left byte-for-byte untouched.
 */
public class GuideRewriter {

    private static final Pattern ICON_SRC = Pattern.compile("<icon src=\"([^\"]+)\"");

    private final ProxyUrlRewriter proxy;

    public GuideRewriter(ProxyUrlRewriter proxy) {
        this.proxy = proxy;
    }

    public String rewriteIcons(String guideXml) {
        Matcher matcher = ICON_SRC.matcher(guideXml);
        StringBuilder sb = new StringBuilder(guideXml.length() + 256);
        while (matcher.find()) {
            // attribute values are XML-escaped; the proxy needs the real URL
            String proxied = proxy.imageUrl(matcher.group(1).replace("&amp;", "&"));
            matcher.appendReplacement(sb, Matcher.quoteReplacement("<icon src=\"" + proxied + "\""));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
