package org.netpreserve.trawler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.netpreserve.trawler.CrawlStats.Count;
import org.netpreserve.trawler.FrontierUrl.Status;
import org.netpreserve.trawler.util.Url;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(InMemoryDatabaseTestExtension.class)
class CrawlStatsTest {

    private final Database database;
    private Frontier frontier;

    CrawlStatsTest(Database database) {
        this.database = database;
    }

    @BeforeEach
    void setUp() {
        frontier = new Frontier(database);
        database.useHandle(handle -> handle.execute("DELETE FROM frontier"));
    }

    private static List<Url> urls(String... urls) {
        return Arrays.stream(urls).map(Url::new).toList();
    }

    @Test
    void testMostCommonOrdersByCountThenFirstSeen() {
        var counts = CrawlStats.mostCommon(urls(
                "https://b.com/1",
                "https://a.com/1",
                "https://c.com/1",
                "https://c.com/2",
                "https://a.com/2",
                "https://d.com/1"), Url::siteHost, 10);

        assertEquals(List.of(
                new Count("a.com", 2),
                new Count("c.com", 2),
                new Count("b.com", 1),
                new Count("d.com", 1)), counts);
    }

    @Test
    void testMostCommonLimitsToTopN() {
        var counts = CrawlStats.mostCommon(urls("https://a.com/", "https://b.com/", "https://c.com/"),
                Url::siteHost, 2);
        assertEquals(List.of(new Count("a.com", 1), new Count("b.com", 1)), counts);
        assertTrue(CrawlStats.mostCommon(List.of(), Url::siteHost, 5).isEmpty());
    }

    @Test
    void testNonPositiveTopNGivesEmptyList() {
        List<Url> urls = urls("https://a.com/", "https://b.com/");
        assertTrue(CrawlStats.mostCommon(urls, Url::siteHost, 0).isEmpty());
        assertTrue(CrawlStats.mostCommon(urls, Url::siteHost, -1).isEmpty());

        frontier.insertIfAbsent(new Url("https://a.com/"), false);
        CrawlStats stats = CrawlStats.compute(frontier, -5);
        assertTrue(stats.topHosts().isEmpty());
        assertTrue(stats.topPausedHosts().isEmpty());
    }

    @Test
    void testWwwIsFoldedIntoHost() {
        var counts = CrawlStats.mostCommon(urls("https://www.A.com/x", "https://a.com/y"), Url::siteHost, 5);
        assertEquals(List.of(new Count("a.com", 2)), counts);
    }

    @Test
    void testCompute() {
        frontier.insertIfAbsent(new Url("https://www.example.com/"), false);
        frontier.insertIfAbsent(new Url("https://example.com/blog/1"), false);
        frontier.insertIfAbsent(new Url("https://example.com/blog/2"), false);
        frontier.insertIfAbsent(new Url("https://example.com/shop/1"), false);
        frontier.insertIfAbsent(new Url("https://other.org/x/1"), Status.VISITED, false);
        frontier.insertIfAbsent(new Url("https://other.org/x/2"), false);
        frontier.pausePrefix("https://example.com/", "p");
        frontier.pausePrefix("https://other.org/", "p");

        CrawlStats stats = CrawlStats.compute(frontier, 10);

        assertEquals(new StatusCounts(1, 1, 4, 0), stats.totals());
        assertEquals(new Url("https://www.example.com/"), stats.earliestSeed());
        assertEquals(List.of(new Count("example.com", 3), new Count("other.org", 1)), stats.topPausedHosts());
        assertEquals(List.of(
                new Count("example.com/blog", 2),
                new Count("example.com/shop", 1),
                new Count("other.org/x", 1)), stats.topPausedSections());
        assertEquals(List.of(new Count("example.com", 4), new Count("other.org", 2)), stats.topHosts());
    }

    @Test
    void testComputeOnEmptyFrontier() {
        CrawlStats stats = CrawlStats.compute(frontier, 10);
        assertEquals(0, stats.totals().total());
        assertNull(stats.earliestSeed());
        assertTrue(stats.topHosts().isEmpty());
    }
}
