package org.netpreserve.trawler;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.trawler.util.Url;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Frontier statistics for the operator.
 *
 * @param totals             status counts
 * @param earliestSeed       the first URL ever added
 * @param topPausedHosts     hosts with the most paused URLs
 * @param topPausedSections  {@code host[/first-path-segment]} prefixes with the most paused URLs
 * @param topHosts           hosts with the most URLs in any status
 */
public record CrawlStats(
        StatusCounts totals,
        @Nullable Url earliestSeed,
        List<Count> topPausedHosts,
        List<Count> topPausedSections,
        List<Count> topHosts) {

    public record Count(String key, long count) {
    }

    public static CrawlStats compute(Frontier frontier, int topN) {
        StatusCounts totals = frontier.statusCounts();
        Url earliest = frontier.earliestUrl();
        List<Url> paused = frontier.listByStatus(FrontierUrl.Status.PAUSED);
        List<Url> all = frontier.listAll();
        return new CrawlStats(totals, earliest,
                mostCommon(paused, Url::siteHost, topN),
                mostCommon(paused, Url::siteSection, topN),
                mostCommon(all, Url::siteHost, topN));
    }

    /**
     * Counts keys and returns the {@code topN} most frequent. Ties keep the order in which keys were first seen.
     */
    static List<Count> mostCommon(List<Url> urls, Function<Url, String> key, int topN) {
        if (topN <= 0) return List.of();
        var counts = new LinkedHashMap<String, Long>();
        for (Url url : urls) {
            counts.merge(key.apply(url), 1L, Long::sum);
        }
        var entries = new ArrayList<>(counts.entrySet());
        // List.sort is stable so equal counts stay in first-seen order
        entries.sort(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()));
        var top = new ArrayList<Count>(Math.min(topN, entries.size()));
        for (var entry : entries) {
            if (top.size() >= topN) break;
            top.add(new Count(entry.getKey(), entry.getValue()));
        }
        return top;
    }
}
