package org.netpreserve.trawler.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.trawler.util.DurationDeserializer;

import java.time.Duration;

/**
 * Configuration for how the crawl should behave.
 *
 * @param userAgent    User-Agent string to identify as to servers
 * @param workers      number of concurrent fetch loops, 0 to size automatically from the CPU count
 * @param delay        pause each worker takes before every fetch
 * @param maxRetries   failed fetches after which a URL is marked as a terminal error
 * @param fetchTimeout connect and request timeout for a single fetch
 */
public record CrawlConfig(
        String userAgent,
        int workers,
        @JsonDeserialize(using = DurationDeserializer.class) Duration delay,
        int maxRetries,
        @JsonDeserialize(using = DurationDeserializer.class) Duration fetchTimeout) {

    public CrawlConfig {
        if (workers < 0) throw new IllegalArgumentException("workers must not be negative");
        if (delay == null) delay = Duration.ofSeconds(1);
        if (delay.isNegative()) throw new IllegalArgumentException("delay must not be negative");
        if (maxRetries < 1) throw new IllegalArgumentException("maxRetries must be at least 1");
        if (fetchTimeout == null) fetchTimeout = Duration.ofSeconds(15);
    }

    /**
     * Fetching is network bound so the automatic size allows several workers per CPU.
     */
    public static int autoWorkers() {
        int cpus = Runtime.getRuntime().availableProcessors();
        return Math.max(2, Math.min(32, cpus * 4));
    }

    public int effectiveWorkers() {
        return workers == 0 ? autoWorkers() : workers;
    }

    public CrawlConfig withWorkers(int workers) {
        return new CrawlConfig(userAgent, workers, delay, maxRetries, fetchTimeout);
    }

    public CrawlConfig withDelay(Duration delay) {
        return new CrawlConfig(userAgent, workers, delay, maxRetries, fetchTimeout);
    }
}
