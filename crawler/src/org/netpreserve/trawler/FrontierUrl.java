package org.netpreserve.trawler;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.trawler.util.Url;

import java.time.Instant;

/**
 * A URL known to the crawl and its current state.
 *
 * @param id               insertion order, used to find the earliest seed
 * @param url              the absolute URL, never changes after insertion
 * @param status           the current crawl status
 * @param lastStatusChange when the status last changed
 * @param lastError        description of the most recent failed fetch, cleared by a successful visit
 * @param retryCount       number of failed fetch attempts, never decreases
 * @param isSitemap        whether the URL is (or is believed to be) a sitemap document
 * @param pauseReason      why the URL was paused, present exactly when the status is PAUSED
 */
public record FrontierUrl(
        long id,
        @NotNull Url url,
        @NotNull Status status,
        Instant lastStatusChange,
        @Nullable String lastError,
        int retryCount,
        boolean isSitemap,
        @Nullable String pauseReason
) {
    public enum Status {
        PENDING, VISITED, PAUSED, ERROR
    }
}
