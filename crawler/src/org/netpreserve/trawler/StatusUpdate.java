package org.netpreserve.trawler;

import org.jetbrains.annotations.Nullable;

/**
 * The optional fields of a status transition. Fields left null (or false) are not changed.
 *
 * @param clearLastError remove any recorded error
 * @param sitemap        new sitemap classification
 * @param pauseReason    reason to record when the new status is PAUSED
 */
public record StatusUpdate(
        boolean clearLastError,
        @Nullable Boolean sitemap,
        @Nullable String pauseReason) {

    public static final StatusUpdate NONE = new StatusUpdate(false, null, null);

    public static StatusUpdate visited(boolean sitemap) {
        return new StatusUpdate(true, sitemap, null);
    }

    public static StatusUpdate paused(String reason) {
        return new StatusUpdate(false, null, reason);
    }
}
