package org.netpreserve.trawler;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.trawler.FrontierUrl.Status;
import org.netpreserve.trawler.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * The durable record of every URL the crawl knows about and its status.
 * <p>
 * All mutation goes through the methods here. Compound operations run inside a single transaction and the
 * database serializes transactions, so a prefix pause can never interleave with a worker's update of a URL in
 * the affected range.
 */
public class Frontier {
    private static final Logger log = LoggerFactory.getLogger(Frontier.class);
    private final Database db;

    public Frontier(Database db) {
        this.db = db;
    }

    /**
     * Inserts a new PENDING record unless the URL is already known.
     *
     * @return true if this call inserted the URL
     */
    public boolean insertIfAbsent(Url url, boolean sitemap) {
        return insertIfAbsent(url, Status.PENDING, sitemap);
    }

    public boolean insertIfAbsent(Url url, Status status, boolean sitemap) {
        return db.frontier().insertIfAbsent(url, status, sitemap, Instant.now()) > 0;
    }

    public @Nullable FrontierUrl get(Url url) {
        return db.frontier().find(url);
    }

    /**
     * Unconditionally moves a URL to a new status. Unknown URLs are ignored.
     */
    public void updateStatus(Url url, Status status, StatusUpdate update) {
        int updated = db.frontier().updateStatus(url, status, update, Instant.now());
        if (updated == 0) log.debug("Status update for unknown URL {} ignored", url);
    }

    /**
     * Moves a URL to a new status only if it currently has the expected status.
     *
     * @return true if the transition was applied
     */
    public boolean transition(Url url, Status expected, Status status, StatusUpdate update) {
        return db.frontier().updateStatusIf(url, expected, status, update, Instant.now()) > 0;
    }

    /**
     * Counts a failed fetch against a PENDING URL, moving it to ERROR once it has failed {@code maxRetries}
     * times.
     *
     * @return the updated record, or null if the URL was no longer PENDING
     */
    public @Nullable FrontierUrl recordFailure(Url url, String error, int maxRetries) {
        return db.inTransaction(dao -> {
            if (dao.frontier().recordFailure(url, error, maxRetries, Instant.now()) == 0) return null;
            return dao.frontier().find(url);
        });
    }

    public List<Url> listByStatus(Status status) {
        return db.frontier().listByStatus(status);
    }

    public List<Url> listByStatus(Status status, String prefix) {
        return db.frontier().listByStatusAndPrefix(status, prefix);
    }

    public List<Url> listAll() {
        return db.frontier().listAll();
    }

    /**
     * Pauses every PENDING URL starting with the prefix. The match is a plain string prefix, so
     * {@code https://a.com} also matches {@code https://a.com.example.org}.
     *
     * @return the number of URLs paused
     */
    public int pausePrefix(String prefix, String reason) {
        return db.frontier().pausePrefix(prefix, reason, Instant.now());
    }

    /**
     * Returns every PAUSED URL starting with the prefix to PENDING.
     */
    public Resumed resumePrefix(String prefix) {
        return db.inTransaction(dao -> {
            List<Url> urls = dao.frontier().listByStatusAndPrefix(Status.PAUSED, prefix);
            int count = dao.frontier().resumePrefix(prefix, Instant.now());
            if (count != urls.size()) {
                log.warn("Resumed {} URLs with prefix {} but selected {}", count, prefix, urls.size());
            }
            return new Resumed(urls, count);
        });
    }

    public List<Url> resumeAll() {
        return resumePrefix("").urls();
    }

    /**
     * Returns every PAUSED URL accepted by the filter to PENDING.
     */
    public List<Url> resumeMatching(Predicate<Url> filter) {
        return db.inTransaction(dao -> {
            var resumed = new ArrayList<Url>();
            Instant now = Instant.now();
            for (Url url : dao.frontier().listByStatus(Status.PAUSED)) {
                if (!filter.test(url)) continue;
                if (dao.frontier().updateStatusIf(url, Status.PAUSED, Status.PENDING, StatusUpdate.NONE, now) > 0) {
                    resumed.add(url);
                }
            }
            return resumed;
        });
    }

    /**
     * The first URL ever inserted, used to infer the crawl's primary domain.
     */
    public @Nullable Url earliestUrl() {
        return db.frontier().earliestUrl();
    }

    public StatusCounts statusCounts() {
        return db.frontier().statusCounts();
    }

    public record Resumed(List<Url> urls, int count) {
    }
}
