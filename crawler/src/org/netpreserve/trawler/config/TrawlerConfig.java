package org.netpreserve.trawler.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Root configuration for a crawl job.
 *
 * @param crawl   how to crawl (workers, politeness, retries)
 * @param storage where state and output are written
 */
public record TrawlerConfig(
        CrawlConfig crawl,
        StorageConfig storage) {

    public static final String CONFIG_FILE = "config.yaml";

    public static ObjectMapper yamlMapper() {
        return new ObjectMapper(new YAMLFactory())
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * Returns the built-in defaults.
     */
    public static TrawlerConfig defaults() {
        try {
            var mapper = yamlMapper();
            return mapper.treeToValue(defaultsTree(mapper), TrawlerConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Loads the defaults and merges {@code config.yaml} from the job directory over them if it exists.
     */
    public static TrawlerConfig load(Path jobDir) throws IOException {
        var mapper = yamlMapper();
        JsonNode tree = defaultsTree(mapper);
        Path configFile = jobDir.resolve(CONFIG_FILE);
        if (Files.exists(configFile)) {
            tree = deepMerge(tree, mapper.readTree(configFile.toFile()));
        }
        return mapper.treeToValue(tree, TrawlerConfig.class);
    }

    private static JsonNode defaultsTree(ObjectMapper mapper) throws IOException {
        try (InputStream stream = Objects.requireNonNull(TrawlerConfig.class.getResourceAsStream("defaults.yaml"),
                "missing defaults.yaml")) {
            return mapper.readTree(stream);
        }
    }

    static JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (override == null || override.isNull() || override.isMissingNode()) return base;
        if (!base.isObject() || !override.isObject()) {
            // for simple values or arrays, always take override
            return override;
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            String key = entry.getKey();
            JsonNode overrideValue = entry.getValue();
            if (merged.has(key)) {
                merged.set(key, deepMerge(merged.get(key), overrideValue));
            } else {
                merged.set(key, overrideValue);
            }
        });
        return merged;
    }

    public TrawlerConfig withCrawl(CrawlConfig crawl) {
        return new TrawlerConfig(crawl, storage);
    }

    public String toYaml() {
        try {
            return yamlMapper().writeValueAsString(this);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
