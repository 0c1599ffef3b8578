package org.netpreserve.trawler.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;

/**
 * An absolute URL string as stored in the frontier.
 * <p>
 * Normalization is deliberately minimal: surrounding whitespace is trimmed and nothing else. Host and path
 * accessors are parsed leniently from the raw string so that URLs which {@link java.net.URI} would reject can
 * still be grouped for statistics.
 */
public class Url {
    private final String url;
    private String host;

    @JsonCreator
    public Url(String url) {
        this.url = url;
    }

    /**
     * Trims whitespace and returns null for blank input.
     */
    public static @Nullable Url normalize(String raw) {
        if (raw == null) return null;
        String trimmed = raw.strip();
        if (trimmed.isEmpty()) return null;
        return new Url(trimmed);
    }

    private static boolean startsWithIgnoreCase(String str, String prefix) {
        return str.regionMatches(true, 0, prefix, 0, prefix.length());
    }

    public boolean isHttp() {
        return startsWithIgnoreCase(url, "http://") ||
               startsWithIgnoreCase(url, "https://");
    }

    public Url withoutFragment() {
        int i = url.indexOf('#');
        if (i == -1) {
            return this;
        }
        return new Url(url.substring(0, i));
    }

    public boolean startsWith(String prefix) {
        return url.startsWith(prefix);
    }

    /**
     * Heuristic used before content-type sniffing: {@code .xml}, {@code .xml.gz} or any mention of "sitemap".
     */
    public boolean looksLikeSitemap() {
        String lower = url.toLowerCase(Locale.ROOT);
        return lower.endsWith(".xml") || lower.endsWith(".xml.gz") || lower.contains("sitemap");
    }

    public boolean isGzip() {
        return url.endsWith(".gz");
    }

    /**
     * Lowercased host without port or userinfo. Empty if the URL has no authority.
     */
    public synchronized String host() {
        if (host == null) {
            host = parseHost(authority());
        }
        return host;
    }

    /**
     * The host with any leading {@code www.} removed, as used for grouping URLs by site.
     */
    public String siteHost() {
        return stripWww(host());
    }

    public static String stripWww(String host) {
        if (host.startsWith("www.")) return host.substring(4);
        return host;
    }

    /**
     * Returns true if this URL's site host equals {@code domain} or is a subdomain of it.
     */
    public boolean isOnDomain(String domain) {
        String h = siteHost();
        return h.equals(domain) || h.endsWith("." + domain);
    }

    public String path() {
        int start = authorityEnd();
        if (start < 0) return "";
        int end = start;
        while (end < url.length() && url.charAt(end) != '?' && url.charAt(end) != '#') end++;
        return url.substring(start, end);
    }

    public @Nullable String firstPathSegment() {
        for (String segment : path().split("/")) {
            if (!segment.isEmpty()) return segment;
        }
        return null;
    }

    /**
     * The {@code host[/first-path-segment]} grouping key used for pause statistics.
     */
    public String siteSection() {
        String segment = firstPathSegment();
        return segment == null ? siteHost() : siteHost() + "/" + segment;
    }

    private int authorityStart() {
        int i = url.indexOf("://");
        return i < 0 ? -1 : i + 3;
    }

    private int authorityEnd() {
        int start = authorityStart();
        if (start < 0) return -1;
        int end = start;
        while (end < url.length()) {
            char c = url.charAt(end);
            if (c == '/' || c == '?' || c == '#') break;
            end++;
        }
        return end;
    }

    private String authority() {
        int start = authorityStart();
        if (start < 0) return "";
        return url.substring(start, authorityEnd());
    }

    private static String parseHost(String authority) {
        int at = authority.lastIndexOf('@');
        String hostAndPort = at >= 0 ? authority.substring(at + 1) : authority;
        if (hostAndPort.startsWith("[")) {
            int close = hostAndPort.indexOf(']');
            if (close > 0) hostAndPort = hostAndPort.substring(0, close + 1);
        } else {
            int colon = hostAndPort.indexOf(':');
            if (colon >= 0) hostAndPort = hostAndPort.substring(0, colon);
        }
        return hostAndPort.toLowerCase(Locale.ROOT);
    }

    @JsonValue
    public String toString() {
        return url;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        Url url1 = (Url) o;
        return url.equals(url1.url);
    }

    @Override
    public int hashCode() {
        return url.hashCode();
    }
}
