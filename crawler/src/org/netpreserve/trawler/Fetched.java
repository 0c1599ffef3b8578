package org.netpreserve.trawler;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.trawler.util.Url;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A successfully fetched response.
 *
 * @param url         the requested URL
 * @param statusCode  the HTTP status code
 * @param contentType the Content-Type header, empty if absent
 * @param body        the raw response body
 */
public record Fetched(Url url, int statusCode, String contentType, byte[] body) {
    private static final Pattern CHARSET_PARAM = Pattern.compile("(?i)charset\\s*=\\s*\"?([^\";\\s]+)");

    public Fetched {
        if (contentType == null) contentType = "";
    }

    public boolean isXml() {
        return contentType.toLowerCase(Locale.ROOT).contains("xml");
    }

    /**
     * The charset named by the Content-Type header, or null if absent or unsupported.
     */
    public @Nullable Charset charset() {
        var matcher = CHARSET_PARAM.matcher(contentType);
        if (!matcher.find()) return null;
        try {
            String name = matcher.group(1);
            return Charset.isSupported(name) ? Charset.forName(name) : null;
        } catch (IllegalCharsetNameException e) {
            return null;
        }
    }
}
