package org.netpreserve.trawler.extract;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One line of the content sink, written for every fetched HTML page.
 */
@JsonPropertyOrder({"url", "title", "status_code", "content"})
public record PageRecord(
        String url,
        String title,
        @JsonProperty("status_code") int statusCode,
        String content) {
    public static final int MAX_CONTENT_LENGTH = 500;

    public static PageRecord of(String url, String title, int statusCode, String text) {
        String content = text.length() > MAX_CONTENT_LENGTH ? text.substring(0, MAX_CONTENT_LENGTH) : text;
        return new PageRecord(url, title, statusCode, content);
    }
}
