package org.netpreserve.trawler;

import org.junit.jupiter.api.Test;
import org.netpreserve.trawler.util.Url;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class WorkQueueTest {

    @Test
    void testFifoOrder() throws InterruptedException {
        var queue = new WorkQueue();
        queue.push(new Url("https://a.com/1"));
        queue.pushAll(List.of(new Url("https://a.com/2"), new Url("https://a.com/3")));

        assertEquals(new Url("https://a.com/1"), queue.poll(0, TimeUnit.MILLISECONDS));
        assertEquals(new Url("https://a.com/2"), queue.poll(0, TimeUnit.MILLISECONDS));
        assertEquals(new Url("https://a.com/3"), queue.poll(0, TimeUnit.MILLISECONDS));
        assertNull(queue.poll(0, TimeUnit.MILLISECONDS));
    }

    @Test
    void testPollTimesOut() throws InterruptedException {
        var queue = new WorkQueue();
        long start = System.nanoTime();
        assertNull(queue.poll(50, TimeUnit.MILLISECONDS));
        assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(40));
    }

    @Test
    void testPollWakesOnPush() throws InterruptedException {
        var queue = new WorkQueue();
        var taken = new ArrayList<Url>();
        var started = new CountDownLatch(1);
        var thread = new Thread(() -> {
            started.countDown();
            try {
                taken.add(queue.poll(5, TimeUnit.SECONDS));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        thread.start();
        started.await();
        queue.push(new Url("https://a.com/"));
        thread.join(5000);

        assertEquals(List.of(new Url("https://a.com/")), taken);
    }

    @Test
    void testRemoveByPrefixKeepsOrderOfOthers() throws InterruptedException {
        var queue = new WorkQueue();
        queue.pushAll(List.of(
                new Url("https://a.com/1"),
                new Url("https://b.com/1"),
                new Url("https://a.com/2"),
                new Url("https://c.com/1"),
                new Url("https://a.com/3")));

        assertEquals(3, queue.removeByPrefix("https://a.com/"));
        assertEquals(2, queue.size());
        assertEquals(new Url("https://b.com/1"), queue.poll(0, TimeUnit.MILLISECONDS));
        assertEquals(new Url("https://c.com/1"), queue.poll(0, TimeUnit.MILLISECONDS));
        assertEquals(0, queue.removeByPrefix("https://a.com/"));
    }

    @Test
    void testRebuildReplacesContents() throws InterruptedException {
        var queue = new WorkQueue();
        queue.push(new Url("https://stale.com/"));
        queue.rebuild(List.of(new Url("https://fresh.com/1"), new Url("https://fresh.com/2")));

        assertEquals(2, queue.size());
        assertEquals(new Url("https://fresh.com/1"), queue.poll(0, TimeUnit.MILLISECONDS));
    }

    @Test
    void testConcurrentProducersAndConsumers() throws InterruptedException {
        var queue = new WorkQueue();
        int producers = 4;
        int perProducer = 250;
        var taken = Collections.synchronizedList(new ArrayList<Url>());
        var threads = new ArrayList<Thread>();
        for (int p = 0; p < producers; p++) {
            int id = p;
            threads.add(new Thread(() -> {
                for (int i = 0; i < perProducer; i++) {
                    queue.push(new Url("https://p" + id + ".com/" + i));
                }
            }));
        }
        for (int c = 0; c < 4; c++) {
            threads.add(new Thread(() -> {
                try {
                    Url url;
                    while ((url = queue.poll(500, TimeUnit.MILLISECONDS)) != null) {
                        taken.add(url);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }));
        }
        for (Thread thread : threads) thread.start();
        for (Thread thread : threads) thread.join(10_000);

        assertEquals(producers * perProducer, taken.size());
        assertEquals(producers * perProducer, new HashSet<>(taken).size());
        assertEquals(0, queue.size());
    }

    @Test
    void testRemoveByPrefixWhileProducersAndConsumersRun() throws InterruptedException {
        var queue = new WorkQueue();
        int dropped = 500;
        for (int i = 0; i < dropped; i++) {
            queue.push(new Url("https://drop.com/" + i));
        }
        int producers = 4;
        int perProducer = 250;
        var taken = Collections.synchronizedList(new ArrayList<Url>());
        var removed = new AtomicInteger();
        var start = new CountDownLatch(1);
        var threads = new ArrayList<Thread>();
        for (int p = 0; p < producers; p++) {
            int id = p;
            threads.add(new Thread(() -> {
                awaitQuietly(start);
                for (int i = 0; i < perProducer; i++) {
                    queue.push(new Url("https://keep" + id + ".com/" + i));
                }
            }));
        }
        for (int c = 0; c < 3; c++) {
            threads.add(new Thread(() -> {
                awaitQuietly(start);
                try {
                    Url url;
                    while ((url = queue.poll(500, TimeUnit.MILLISECONDS)) != null) {
                        taken.add(url);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }));
        }
        threads.add(new Thread(() -> {
            awaitQuietly(start);
            for (int i = 0; i < 20; i++) {
                removed.addAndGet(queue.removeByPrefix("https://drop.com/"));
                Thread.yield();
            }
        }));
        for (Thread thread : threads) thread.start();
        start.countDown();
        for (Thread thread : threads) thread.join(10_000);

        long keptTaken = taken.stream().filter(url -> url.toString().startsWith("https://keep")).count();
        long droppedTaken = taken.size() - keptTaken;
        assertEquals(producers * perProducer, keptTaken, "removal must not lose other URLs");
        assertEquals(dropped, droppedTaken + removed.get(), "each dropped URL is either taken or removed");
        assertEquals(taken.size(), new HashSet<>(taken).size());
        assertEquals(0, queue.removeByPrefix("https://drop.com/"));
        assertEquals(0, queue.size());
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
