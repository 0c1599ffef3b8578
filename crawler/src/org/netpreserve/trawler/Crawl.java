package org.netpreserve.trawler;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.trawler.config.CrawlConfig;
import org.netpreserve.trawler.config.TrawlerConfig;
import org.netpreserve.trawler.extract.ContentDispatcher;
import org.netpreserve.trawler.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A crawl job: the frontier, the work queue, the worker pool and the operator controls over them.
 * <p>
 * Control operations may be called from any thread while workers run. Each one changes the frontier first and
 * then brings the work queue in line with it.
 */
public class Crawl implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Crawl.class);
    public static final String DEFAULT_PAUSE_REASON = "user-pause";
    public static final String DEFAULT_PREFIX_PAUSE_REASON = "user-pause-prefix";
    private static final long STOP_WAIT_MILLIS = 2000;
    private final Database db;
    private final Frontier frontier;
    private final WorkQueue queue = new WorkQueue();
    private final Fetcher fetcher;
    private final ContentDispatcher dispatcher = new ContentDispatcher();
    private final ContentSink contentSink;
    private final TrawlerConfig config;
    private final List<Worker> workers = new ArrayList<>();
    private volatile State state = State.STOPPED;
    private final Lock startStopLock = new ReentrantLock();
    private volatile String primaryDomain;

    public enum State {
        STOPPED, STARTING, RUNNING, STOPPING
    }

    /**
     * Result of a single-URL control operation.
     */
    public enum Change {
        APPLIED,
        UNKNOWN_URL,
        /** the URL exists but its status does not allow the change */
        NOT_APPLICABLE
    }

    public record PrefixPause(int paused, int dequeued) {
    }

    /**
     * Running worker count alongside the frontier counts.
     */
    public record Overview(int workers, StatusCounts counts) {
    }

    public Crawl(Path jobDir, TrawlerConfig config) {
        this(Database.open(jobDir.resolve(config.storage().database())),
                new HttpFetcher(config.crawl().userAgent(), config.crawl().fetchTimeout()),
                new ContentSink(jobDir.resolve(config.storage().contentFile())),
                config);
    }

    public Crawl(Database db, Fetcher fetcher, ContentSink contentSink, TrawlerConfig config) {
        this.db = db;
        this.frontier = new Frontier(db);
        this.fetcher = fetcher;
        this.contentSink = contentSink;
        this.config = config;

        Url earliest = frontier.earliestUrl();
        if (earliest != null) {
            primaryDomain = earliest.siteHost();
        }

        List<Url> pending = frontier.listByStatus(FrontierUrl.Status.PENDING);
        queue.rebuild(pending);
        CrawlConfig crawlConfig = config.crawl();
        log.info("Initialized crawl (workers={}, delay={}ms, pending={})", crawlConfig.effectiveWorkers(),
                crawlConfig.delay().toMillis(), pending.size());
    }

    public void start() throws BadStateException {
        if (!startStopLock.tryLock()) throw new BadStateException("Crawl busy " + state);
        try {
            if (state != State.STOPPED) throw new BadStateException("Can only start a STOPPED crawl");
            state = State.STARTING;
            try {
                int count = config.crawl().effectiveWorkers();
                for (int i = 0; i < count; i++) {
                    workers.add(new Worker(String.valueOf(i + 1), this));
                }
                for (Worker worker : workers) {
                    worker.start();
                }
            } catch (RuntimeException | Error e) {
                // workers is empty while STOPPED so only this call's workers are rolled back
                stopWorkers();
                state = State.STOPPED;
                throw e;
            }
            state = State.RUNNING;
            log.info("Started {} worker threads", workers.size());
        } finally {
            startStopLock.unlock();
        }
    }

    /**
     * Signals every worker to exit at its next queue poll. Fetches already in flight are not interrupted.
     */
    public void stop() throws BadStateException {
        if (!startStopLock.tryLock()) throw new BadStateException("Crawl busy " + state);
        try {
            if (state != State.RUNNING) throw new BadStateException("Can only stop a RUNNING crawl");
            state = State.STOPPING;
            stopWorkers();
            state = State.STOPPED;
            log.info("Stopped crawl");
        } finally {
            startStopLock.unlock();
        }
    }

    private void stopWorkers() {
        for (Worker worker : workers) {
            worker.closeAsyncGraceful();
        }
        long deadline = System.currentTimeMillis() + STOP_WAIT_MILLIS;
        for (Worker worker : workers) {
            worker.join(Math.max(1, deadline - System.currentTimeMillis()));
        }
        workers.clear();
    }

    @Override
    public void close() {
        startStopLock.lock();
        try {
            if (state == State.RUNNING) {
                state = State.STOPPING;
                stopWorkers();
            }
            try {
                db.close();
            } catch (Exception e) {
                log.error("Failed to close database", e);
            }
            state = State.STOPPED;
            log.info("Closed crawl database");
        } finally {
            startStopLock.unlock();
        }
    }

    /**
     * Registers a URL found by a worker. Only the caller that actually inserts it queues it.
     */
    boolean enqueueIfNew(Url url, boolean sitemap) {
        if (!frontier.insertIfAbsent(url, sitemap)) return false;
        queue.push(url);
        log.info("Enqueued new URL: {}", url);
        return true;
    }

    /**
     * Adds a seed URL.
     *
     * @return false if the URL was already known
     * @throws IllegalArgumentException if the URL is blank or not http(s)
     */
    public boolean seed(String rawUrl) {
        Url url = Url.normalize(rawUrl);
        if (url == null || !url.isHttp()) {
            throw new IllegalArgumentException("Invalid URL: " + rawUrl);
        }
        if (!enqueueIfNew(url, url.looksLikeSitemap())) {
            log.debug("Seed skipped (exists): {}", url);
            return false;
        }
        log.info("Seeded URL: {}", url);
        if (primaryDomain == null && !url.siteHost().isEmpty()) {
            primaryDomain = url.siteHost();
        }
        return true;
    }

    public Change pauseUrl(String rawUrl, String reason) {
        Url url = Url.normalize(rawUrl);
        if (url == null) return Change.UNKNOWN_URL;
        FrontierUrl frontierUrl = frontier.get(url);
        if (frontierUrl == null) return Change.UNKNOWN_URL;
        // pausing a paused URL replaces its reason, finished URLs are never paused
        FrontierUrl.Status from = frontierUrl.status() == FrontierUrl.Status.PAUSED ?
                FrontierUrl.Status.PAUSED : FrontierUrl.Status.PENDING;
        if (!frontier.transition(url, from, FrontierUrl.Status.PAUSED, StatusUpdate.paused(reason))) {
            log.info("Not pausing {} with status {}", url, frontierUrl.status());
            return Change.NOT_APPLICABLE;
        }
        log.info("Paused URL: {} reason={}", url, reason);
        return Change.APPLIED;
    }

    public Change resumeUrl(String rawUrl) {
        Url url = Url.normalize(rawUrl);
        if (url == null) return Change.UNKNOWN_URL;
        FrontierUrl frontierUrl = frontier.get(url);
        if (frontierUrl == null) return Change.UNKNOWN_URL;
        if (!frontier.transition(url, FrontierUrl.Status.PAUSED, FrontierUrl.Status.PENDING, StatusUpdate.NONE)) {
            log.info("Not resuming {} as it is {} rather than PAUSED", url, frontierUrl.status());
            return Change.NOT_APPLICABLE;
        }
        queue.push(url);
        log.info("Resumed URL: {}", url);
        return Change.APPLIED;
    }

    public PrefixPause pausePrefix(String prefix, String reason) {
        int paused = frontier.pausePrefix(prefix, reason);
        int dequeued = queue.removeByPrefix(prefix);
        log.info("Paused {} URL(s) with prefix: {} reason={} removed_from_queue={}", paused, prefix, reason, dequeued);
        return new PrefixPause(paused, dequeued);
    }

    public int resumePrefix(String prefix) {
        Frontier.Resumed resumed = frontier.resumePrefix(prefix);
        queue.pushAll(resumed.urls());
        log.info("Resumed {} URL(s) with prefix: {}", resumed.count(), prefix);
        return resumed.count();
    }

    public int resumeAll() {
        List<Url> urls = frontier.resumeAll();
        queue.pushAll(urls);
        if (!urls.isEmpty()) log.info("Resumed all paused: {} URL(s)", urls.size());
        return urls.size();
    }

    /**
     * Resumes paused URLs whose host is the domain or one of its subdomains.
     */
    public int resumeForDomain(String domain) {
        String normalized = Url.stripWww(domain.strip().toLowerCase(Locale.ROOT));
        List<Url> urls = frontier.resumeMatching(url -> url.isOnDomain(normalized));
        queue.pushAll(urls);
        if (!urls.isEmpty()) log.info("Resumed {} paused URL(s) for domain {}", urls.size(), normalized);
        return urls.size();
    }

    public List<Url> listPaused() {
        return frontier.listByStatus(FrontierUrl.Status.PAUSED);
    }

    public List<Url> listPending(String prefix) {
        return frontier.listByStatus(FrontierUrl.Status.PENDING, prefix);
    }

    public StatusCounts statusCounts() {
        return frontier.statusCounts();
    }

    public Overview status() {
        return new Overview(state == State.RUNNING ? workers.size() : 0, frontier.statusCounts());
    }

    public CrawlStats stats(int topN) {
        return CrawlStats.compute(frontier, topN);
    }

    public @Nullable String primaryDomain() {
        return primaryDomain;
    }

    public void setPrimaryDomain(String domain) {
        this.primaryDomain = Url.stripWww(domain.strip().toLowerCase(Locale.ROOT));
    }

    public List<Worker.Info> workerInfo() {
        List<Worker> workers;
        startStopLock.lock();
        try {
            workers = new ArrayList<>(this.workers);
        } finally {
            startStopLock.unlock();
        }
        List<Worker.Info> infoList = new ArrayList<>(workers.size());
        for (var worker : workers) {
            infoList.add(worker.info());
        }
        return infoList;
    }

    public State state() {
        return state;
    }

    public TrawlerConfig config() {
        return config;
    }

    Frontier frontier() {
        return frontier;
    }

    WorkQueue queue() {
        return queue;
    }

    Fetcher fetcher() {
        return fetcher;
    }

    ContentDispatcher dispatcher() {
        return dispatcher;
    }

    ContentSink contentSink() {
        return contentSink;
    }

    /**
     * The crawl was not in an appropriate state for this action.
     */
    public static class BadStateException extends Exception {
        public BadStateException(String message) {
            super(message);
        }
    }
}
