package org.netpreserve.trawler.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.trawler.util.ByteSizeDeserializer;

/**
 * Where crawl state and output live. Relative file names are resolved against the job directory.
 *
 * @param database    SQLite frontier database
 * @param contentFile JSON lines file receiving one record per fetched HTML page
 * @param logFile     diagnostic log
 * @param logMaxSize  size at which the diagnostic log is rolled over
 * @param logBackups  number of rolled-over log files to keep
 */
public record StorageConfig(
        String database,
        String contentFile,
        String logFile,
        @JsonDeserialize(using = ByteSizeDeserializer.class) long logMaxSize,
        int logBackups) {
}
