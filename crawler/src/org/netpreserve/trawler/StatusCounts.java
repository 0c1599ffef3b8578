package org.netpreserve.trawler;

/**
 * A consistent snapshot of how many URLs are in each status.
 */
public record StatusCounts(long pending, long visited, long paused, long error) {
    public long total() {
        return pending + visited + paused + error;
    }
}
