package org.netpreserve.trawler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.netpreserve.trawler.extract.PageRecord;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ContentSinkTest {

    @TempDir
    Path tempDir;

    @Test
    void testAppendWritesOneJsonObjectPerLine() throws IOException {
        var sink = new ContentSink(tempDir.resolve("data.jsonl"));
        sink.append(PageRecord.of("https://example.com/", "Exämple", 200, "line one\nline two"));
        sink.append(PageRecord.of("https://example.com/2", "", 200, "x".repeat(600)));

        List<String> lines = Files.readAllLines(sink.file());
        assertEquals(2, lines.size());

        JsonNode first = new ObjectMapper().readTree(lines.get(0));
        List<String> fields = new ArrayList<>();
        for (Iterator<String> it = first.fieldNames(); it.hasNext(); ) fields.add(it.next());
        assertEquals(List.of("url", "title", "status_code", "content"), fields);
        assertEquals("Exämple", first.get("title").asText());
        assertEquals("line one\nline two", first.get("content").asText());

        JsonNode second = new ObjectMapper().readTree(lines.get(1));
        assertEquals(PageRecord.MAX_CONTENT_LENGTH, second.get("content").asText().length());
    }

    @Test
    void testConcurrentAppendsDoNotInterleave() throws Exception {
        var sink = new ContentSink(tempDir.resolve("data.jsonl"));
        int threads = 8;
        int perThread = 50;
        var workers = new ArrayList<Thread>();
        for (int t = 0; t < threads; t++) {
            int id = t;
            workers.add(new Thread(() -> {
                for (int i = 0; i < perThread; i++) {
                    try {
                        sink.append(PageRecord.of("https://example.com/" + id + "/" + i, "t", 200, "body ".repeat(40)));
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                }
            }));
        }
        for (Thread worker : workers) worker.start();
        for (Thread worker : workers) worker.join(10_000);

        List<String> lines = Files.readAllLines(sink.file());
        assertEquals(threads * perThread, lines.size());
        var mapper = new ObjectMapper();
        Set<String> urls = new HashSet<>();
        for (String line : lines) {
            urls.add(mapper.readTree(line).get("url").asText());
        }
        assertEquals(threads * perThread, urls.size());
    }

    @Test
    void testAppendToUnwritablePathFails() throws IOException {
        Path directory = Files.createDirectory(tempDir.resolve("dir"));
        var sink = new ContentSink(directory);
        assertThrows(IOException.class, () -> sink.append(PageRecord.of("https://example.com/", "", 200, "")));
    }
}
