package org.netpreserve.trawler;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.netpreserve.trawler.extract.PageRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import static java.nio.file.StandardOpenOption.APPEND;
import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.WRITE;

/**
 * Appends page records to a JSON lines file. Each append opens, writes one complete line and closes the file
 * while holding a lock, so concurrent workers never interleave partial records.
 */
public class ContentSink {
    private static final Logger log = LoggerFactory.getLogger(ContentSink.class);
    private final Path file;
    private final ObjectMapper mapper = new ObjectMapper();
    private final Lock lock = new ReentrantLock();

    public ContentSink(Path file) {
        this.file = file;
    }

    public void append(PageRecord record) throws IOException {
        String line = mapper.writeValueAsString(record) + "\n";
        lock.lock();
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8, CREATE, WRITE, APPEND)) {
            writer.write(line);
        } finally {
            lock.unlock();
        }
        log.info("Saved record: {} status={}", record.url(), record.statusCode());
    }

    public Path file() {
        return file;
    }
}
