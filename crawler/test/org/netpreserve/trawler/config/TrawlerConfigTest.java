package org.netpreserve.trawler.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class TrawlerConfigTest {

    @TempDir
    Path jobDir;

    @Test
    void testDefaults() {
        TrawlerConfig config = TrawlerConfig.defaults();

        assertEquals("Trawler/1.0 (+https://example.com/bot)", config.crawl().userAgent());
        assertEquals(0, config.crawl().workers());
        assertEquals(CrawlConfig.autoWorkers(), config.crawl().effectiveWorkers());
        assertEquals(Duration.ofSeconds(1), config.crawl().delay());
        assertEquals(3, config.crawl().maxRetries());
        assertEquals(Duration.ofSeconds(15), config.crawl().fetchTimeout());
        assertEquals("crawler_state.db", config.storage().database());
        assertEquals("scraped_data.jsonl", config.storage().contentFile());
        assertEquals("crawler.log", config.storage().logFile());
        assertEquals(5 * 1024 * 1024, config.storage().logMaxSize());
        assertEquals(5, config.storage().logBackups());
    }

    @Test
    void testLoadWithoutConfigFileGivesDefaults() throws IOException {
        assertEquals(TrawlerConfig.defaults(), TrawlerConfig.load(jobDir));
    }

    @Test
    void testJobConfigIsMergedOverDefaults() throws IOException {
        Files.writeString(jobDir.resolve(TrawlerConfig.CONFIG_FILE), """
                crawl:
                  workers: 4
                  delay: 250ms
                storage:
                  logMaxSize: 512K
                """);

        TrawlerConfig config = TrawlerConfig.load(jobDir);

        assertEquals(4, config.crawl().workers());
        assertEquals(4, config.crawl().effectiveWorkers());
        assertEquals(Duration.ofMillis(250), config.crawl().delay());
        assertEquals(3, config.crawl().maxRetries(), "unset keys keep their defaults");
        assertEquals("Trawler/1.0 (+https://example.com/bot)", config.crawl().userAgent());
        assertEquals(512 * 1024, config.storage().logMaxSize());
        assertEquals("crawler_state.db", config.storage().database());
    }

    @Test
    void testInvalidConfigRejected() throws IOException {
        Files.writeString(jobDir.resolve(TrawlerConfig.CONFIG_FILE), "crawl:\n  maxRetries: 0\n");
        assertThrows(Exception.class, () -> TrawlerConfig.load(jobDir));

        CrawlConfig crawl = TrawlerConfig.defaults().crawl();
        assertThrows(IllegalArgumentException.class, () -> crawl.withWorkers(-1));
        assertThrows(IllegalArgumentException.class, () -> crawl.withDelay(Duration.ofMillis(-1)));
    }

    @Test
    void testOverrides() {
        TrawlerConfig config = TrawlerConfig.defaults();
        TrawlerConfig overridden = config.withCrawl(config.crawl().withWorkers(7).withDelay(Duration.ZERO));

        assertEquals(7, overridden.crawl().effectiveWorkers());
        assertEquals(Duration.ZERO, overridden.crawl().delay());
        assertEquals(config.storage(), overridden.storage());
    }

    @Test
    void testAutoWorkersBounds() {
        int workers = CrawlConfig.autoWorkers();
        assertTrue(workers >= 2 && workers <= 32, "auto workers " + workers);
    }

    @Test
    void testDeepMerge() throws IOException {
        var mapper = new ObjectMapper();
        JsonNode base = mapper.readTree("{\"a\": {\"x\": 1, \"y\": [1, 2]}, \"b\": 2}");
        JsonNode override = mapper.readTree("{\"a\": {\"y\": [3], \"z\": 4}, \"c\": 5}");

        assertEquals(mapper.readTree("{\"a\": {\"x\": 1, \"y\": [3], \"z\": 4}, \"b\": 2, \"c\": 5}"),
                TrawlerConfig.deepMerge(base, override));
        assertEquals(base, TrawlerConfig.deepMerge(base, mapper.nullNode()));
    }

    @Test
    void testYamlRoundTrip() throws IOException {
        TrawlerConfig config = TrawlerConfig.defaults();
        String yaml = config.toYaml();

        assertTrue(yaml.contains("userAgent"), yaml);
        assertEquals(config, TrawlerConfig.yamlMapper().readValue(yaml, TrawlerConfig.class));
    }
}
