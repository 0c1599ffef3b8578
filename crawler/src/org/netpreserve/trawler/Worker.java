package org.netpreserve.trawler;

import org.netpreserve.trawler.FrontierUrl.Status;
import org.netpreserve.trawler.config.CrawlConfig;
import org.netpreserve.trawler.extract.ContentDispatcher;
import org.netpreserve.trawler.extract.Dispatch;
import org.netpreserve.trawler.extract.Link;
import org.netpreserve.trawler.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * A fetch loop draining the work queue.
 */
public class Worker {
    private static final Logger log = LoggerFactory.getLogger(Worker.class);
    private static final long POLL_MILLIS = 1000;
    final String id;
    private final Crawl crawl;
    private final Frontier frontier;
    private final WorkQueue queue;
    private final Fetcher fetcher;
    private final ContentDispatcher dispatcher;
    private final ContentSink contentSink;
    private final CrawlConfig config;
    private Thread thread;
    private volatile boolean closed = false;
    private volatile Info info;

    /**
     * What became of a URL taken from the queue.
     */
    public enum Outcome {
        /** the URL was no longer pending when the worker got to it */
        SKIPPED,
        VISITED,
        /** the fetch failed and the URL was queued again */
        RETRY,
        /** the fetch failed for the last time */
        ERROR,
        /** the URL's status changed during the fetch and the operator's change was kept */
        SUPERSEDED
    }

    public Worker(String id, Crawl crawl) {
        this.id = id;
        this.crawl = crawl;
        this.frontier = crawl.frontier();
        this.queue = crawl.queue();
        this.fetcher = crawl.fetcher();
        this.dispatcher = crawl.dispatcher();
        this.contentSink = crawl.contentSink();
        this.config = crawl.config().crawl();
        info = new Info(id, null, Instant.now());
    }

    public void closeAsyncGraceful() {
        closed = true;
    }

    /**
     * Waits up to the timeout for the loop to notice it has been closed.
     */
    void join(long timeoutMillis) {
        if (thread == null) return;
        try {
            thread.join(timeoutMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (thread.isAlive()) {
            log.info("Worker {} still busy with {}, leaving it to finish", id, info.url());
        }
    }

    void run() {
        while (!closed) {
            Url url;
            try {
                url = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                return;
            }
            if (url == null) continue;

            updateInfo(new Info(id, url, Instant.now()));
            try {
                process(url);
            } catch (InterruptedException e) {
                log.info("Worker {} interrupted while processing {}", id, url);
                return;
            } catch (Exception e) {
                log.error("Unexpected error in worker {} for {}", id, url, e);
            } finally {
                updateInfo(new Info(id, null, Instant.now()));
            }
        }
    }

    /**
     * Handles one URL taken from the queue.
     */
    Outcome process(Url url) throws InterruptedException {
        // the queue is only a hint, the frontier decides whether this URL is still wanted
        FrontierUrl frontierUrl = frontier.get(url);
        if (frontierUrl == null || frontierUrl.status() != Status.PENDING) {
            log.debug("Skipping {} as it is no longer pending", url);
            return Outcome.SKIPPED;
        }

        long delayMillis = config.delay().toMillis();
        if (delayMillis > 0) {
            Thread.sleep(delayMillis);
        }

        boolean sitemap;
        try {
            log.atInfo().addKeyValue("worker", id).addKeyValue("url", url).log("Fetching");
            Fetched fetched = fetcher.fetch(url);
            Dispatch dispatch = dispatcher.dispatch(fetched);
            for (Link link : dispatch.links()) {
                crawl.enqueueIfNew(link.url(), link.sitemap());
            }
            if (dispatch.page() != null) {
                contentSink.append(dispatch.page());
            }
            sitemap = dispatch.sitemap();
        } catch (IOException | RuntimeException e) {
            return handleFailure(frontierUrl, describe(e));
        }

        if (!frontier.transition(url, Status.PENDING, Status.VISITED, StatusUpdate.visited(sitemap))) {
            log.info("Status of {} changed during fetch, not marking visited", url);
            return Outcome.SUPERSEDED;
        }
        log.info("Visited: {}", url);
        return Outcome.VISITED;
    }

    private Outcome handleFailure(FrontierUrl frontierUrl, String error) {
        Url url = frontierUrl.url();
        log.atWarn().addKeyValue("worker", id).addKeyValue("url", url).log("Error fetching {}: {}", url, error);
        FrontierUrl failed = frontier.recordFailure(url, error, config.maxRetries());
        if (failed == null) {
            log.info("Status of {} changed during fetch, not recording failure", url);
            return Outcome.SUPERSEDED;
        }
        if (failed.status() == Status.ERROR) {
            log.error("Marked error after {} attempts: {} error={}", failed.retryCount(), url, error);
            return Outcome.ERROR;
        }
        queue.push(url);
        log.info("Re-queued for retry: {} (attempt {} of {})", url, failed.retryCount(), config.maxRetries());
        return Outcome.RETRY;
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) return e.getClass().getSimpleName();
        return message;
    }

    private void updateInfo(Info info) {
        this.info = info;
    }

    public synchronized void start() {
        log.info("Starting worker {}", id);
        thread = new Thread(() -> {
            try {
                run();
            } catch (Throwable e) {
                log.error("Worker {} crashed", id, e);
            }
        }, "worker-" + id);
        thread.setDaemon(true);
        thread.start();
    }

    /**
     * @param url the URL currently being processed, null when idle
     */
    public record Info(
            String id,
            Url url,
            Instant updateTime) {
    }

    public Info info() {
        return info;
    }
}
