package org.netpreserve.trawler;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.trawler.util.Url;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory dispatch queue over the frontier's PENDING set.
 * <p>
 * The queue is only a hint: workers re-read a URL's status after taking it and the frontier's answer wins.
 * Because of that {@link #removeByPrefix} is best effort. A URL a worker took before the removal started is still
 * processed, and the worker's status check is what stops it being fetched.
 */
public class WorkQueue {
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final ArrayDeque<Url> queue = new ArrayDeque<>();

    public void push(Url url) {
        lock.lock();
        try {
            queue.addLast(url);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    public void pushAll(Collection<Url> urls) {
        if (urls.isEmpty()) return;
        lock.lock();
        try {
            queue.addAll(urls);
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Takes the next URL, waiting up to the given time for one to arrive.
     *
     * @return the URL or null if the wait timed out
     */
    public @Nullable Url poll(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (queue.isEmpty()) {
                if (nanos <= 0L) return null;
                nanos = notEmpty.awaitNanos(nanos);
            }
            return queue.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every queued URL starting with the prefix, keeping the order of the rest.
     *
     * @return the number removed
     */
    public int removeByPrefix(String prefix) {
        lock.lock();
        try {
            int before = queue.size();
            queue.removeIf(url -> url.startsWith(prefix));
            return before - queue.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the queue's contents, used to reload the PENDING set from the frontier at startup.
     */
    public void rebuild(Collection<Url> pending) {
        lock.lock();
        try {
            queue.clear();
            queue.addAll(pending);
            if (!queue.isEmpty()) notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }
}
