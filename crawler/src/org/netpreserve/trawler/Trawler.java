package org.netpreserve.trawler;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.rolling.FixedWindowRollingPolicy;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.SizeBasedTriggeringPolicy;
import ch.qos.logback.core.util.FileSize;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.trawler.config.CrawlConfig;
import org.netpreserve.trawler.config.StorageConfig;
import org.netpreserve.trawler.config.TrawlerConfig;
import org.netpreserve.trawler.util.DurationDeserializer;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public class Trawler {

    private static final org.slf4j.Logger log = LoggerFactory.getLogger(Trawler.class);

    static final String USAGE = """
            Usage: trawler [options] [URL...]
            Options:
              -h, --help
              -j, --job-dir DIR        Directory for crawl state and output (default: data)
              -w, --workers N          Number of worker threads (0 = auto)
              -d, --delay DURATION     Politeness delay before each fetch (e.g. 500ms, 2s)
                  --dump-config        Print the effective configuration and exit""";

    record Options(Path jobDir, @Nullable Integer workers, @Nullable Duration delay, boolean dumpConfig,
                   boolean help, List<String> seeds) {
    }

    /**
     * @throws IllegalArgumentException naming the offending option
     */
    static Options parseArgs(String[] args) {
        Path jobDir = Path.of("data");
        Integer workers = null;
        Duration delay = null;
        var seeds = new ArrayList<String>();
        boolean dumpConfig = false;
        boolean help = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--dump-config" -> dumpConfig = true;
                case "--help", "-h" -> help = true;
                case "--job-dir", "-j" -> jobDir = Path.of(value(args, ++i, arg));
                case "--workers", "-w" -> {
                    String value = value(args, ++i, arg);
                    try {
                        workers = Integer.parseInt(value);
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Invalid number for " + arg + ": " + value);
                    }
                    if (workers < 0) throw new IllegalArgumentException(arg + " must not be negative: " + value);
                }
                case "--delay", "-d" -> {
                    String value = value(args, ++i, arg);
                    try {
                        delay = DurationDeserializer.parse(value);
                    } catch (IOException e) {
                        throw new IllegalArgumentException("Invalid duration for " + arg + ": " + value);
                    }
                }
                default -> {
                    if (arg.startsWith("-")) throw new IllegalArgumentException("Unknown option: " + arg);
                    seeds.add(arg);
                }
            }
        }
        return new Options(jobDir, workers, delay, dumpConfig, help, seeds);
    }

    private static String value(String[] args, int i, String option) {
        if (i >= args.length) throw new IllegalArgumentException("Missing value for " + option);
        return args[i];
    }

    public static void main(String[] args) throws Exception {
        Options options;
        try {
            options = parseArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            System.exit(1);
            return;
        }
        if (options.help()) {
            System.out.println(USAGE);
            System.exit(0);
        }
        Path jobDir = options.jobDir();
        Integer workers = options.workers();
        Duration delay = options.delay();
        boolean dumpConfig = options.dumpConfig();
        List<String> seeds = options.seeds();

        TrawlerConfig config = TrawlerConfig.load(jobDir);
        CrawlConfig crawlConfig = config.crawl();
        if (workers != null) crawlConfig = crawlConfig.withWorkers(workers);
        if (delay != null) crawlConfig = crawlConfig.withDelay(delay);
        config = config.withCrawl(crawlConfig);
        if (dumpConfig) {
            System.out.println(config.toYaml());
            System.exit(0);
        }

        Files.createDirectories(jobDir);
        startDiagnosticLog(jobDir, config.storage());
        log.info("Starting crawler in {}", jobDir.toAbsolutePath());

        Crawl crawl = new Crawl(jobDir, config);
        for (String seed : seeds) {
            try {
                crawl.seed(seed);
            } catch (IllegalArgumentException e) {
                System.err.println("Ignoring invalid seed URL: " + seed);
            }
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                crawl.close();
            } catch (Exception e) {
                System.err.println("Error shutting down crawl: " + e.getMessage());
                e.printStackTrace(System.err);
            }
        }, "shutdown-hook"));

        var in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        new Console(crawl, in, System.out).run();
        System.out.println("Crawler stopped.");
        System.exit(0);
    }

    /**
     * Sends INFO and above to a size-rotated file in the job directory.
     */
    private static void startDiagnosticLog(Path jobDir, StorageConfig storage) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        String file = jobDir.resolve(storage.logFile()).toString();

        var encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern("%d %level [%thread] %msg%n");
        encoder.start();

        var appender = new RollingFileAppender<ILoggingEvent>();
        appender.setContext(context);
        appender.setName("diagnostic-file");
        appender.setFile(file);
        appender.setEncoder(encoder);

        var rollingPolicy = new FixedWindowRollingPolicy();
        rollingPolicy.setContext(context);
        rollingPolicy.setParent(appender);
        rollingPolicy.setFileNamePattern(file + ".%i");
        rollingPolicy.setMinIndex(1);
        rollingPolicy.setMaxIndex(Math.max(1, storage.logBackups()));
        rollingPolicy.start();

        var triggeringPolicy = new SizeBasedTriggeringPolicy<ILoggingEvent>();
        triggeringPolicy.setContext(context);
        triggeringPolicy.setMaxFileSize(new FileSize(storage.logMaxSize()));
        triggeringPolicy.start();

        appender.setRollingPolicy(rollingPolicy);
        appender.setTriggeringPolicy(triggeringPolicy);
        appender.start();

        var logger = (Logger) LoggerFactory.getLogger("org.netpreserve.trawler");
        logger.setLevel(Level.INFO);
        logger.addAppender(appender);
    }
}
