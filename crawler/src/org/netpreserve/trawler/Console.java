package org.netpreserve.trawler;

import org.netpreserve.trawler.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Interactive operator console: a startup menu followed by a command loop while the workers run.
 */
public class Console {
    private static final Logger log = LoggerFactory.getLogger(Console.class);
    private static final int LIST_LIMIT = 20;
    private static final int STATS_TOP_N = 10;
    private final Crawl crawl;
    private final BufferedReader in;
    private final PrintStream out;

    public Console(Crawl crawl, BufferedReader in, PrintStream out) {
        this.crawl = crawl;
        this.in = in;
        this.out = out;
    }

    public void run() throws IOException {
        if (startupMenu()) {
            commandLoop();
        }
    }

    private String prompt(String message) throws IOException {
        out.print(message);
        out.flush();
        String line = in.readLine();
        return line == null ? null : line.strip();
    }

    /**
     * Shows the startup menu until the operator starts the crawl or exits.
     *
     * @return true if the crawl was started
     */
    boolean startupMenu() throws IOException {
        while (true) {
            StatusCounts counts = crawl.statusCounts();
            out.printf("%nCurrent DB state -> Pending: %d, Visited: %d, Paused: %d, Error: %d%n",
                    counts.pending(), counts.visited(), counts.paused(), counts.error());
            out.println("""
                    
                    Startup options:
                      1) Add new seed URL
                      2) Resume paused URLs and start crawling
                      3) Resume specific paused URL(s) and start crawling
                      4) Pause a URL
                      5) List pending URLs by prefix
                      6) Pause URLs by prefix
                      7) Show crawler stats
                      8) Exit
                    """);
            String choice = prompt("Select an option (1-8): ");
            if (choice == null) return false;
            switch (choice) {
                case "1" -> {
                    String seed = prompt("Enter seed URL (leave blank to cancel): ");
                    if (seed != null && !seed.isEmpty()) seed(seed);
                }
                case "2" -> {
                    if (resumeAndConfirm(counts)) return startCrawl();
                }
                case "3" -> {
                    if (resumeSelected()) return startCrawl();
                }
                case "4" -> {
                    String url = prompt("Enter URL to pause (leave blank to cancel): ");
                    if (url != null && !url.isEmpty()) pause(url);
                }
                case "5" -> {
                    String prefix = prompt("Enter URL prefix to list pending (leave blank to cancel): ");
                    if (prefix != null && !prefix.isEmpty()) listPending(prefix);
                }
                case "6" -> {
                    String prefix = prompt("Enter URL prefix to pause (leave blank to cancel): ");
                    if (prefix != null && !prefix.isEmpty()) pausePrefix(prefix);
                }
                case "7" -> printStats(STATS_TOP_N);
                case "8" -> {
                    out.println("Exiting without starting crawler.");
                    return false;
                }
                default -> out.println("Invalid option, please choose a number between 1 and 8.");
            }
        }
    }

    private boolean resumeAndConfirm(StatusCounts counts) throws IOException {
        int resumed;
        String domain = crawl.primaryDomain();
        if (domain != null) {
            out.println("Resuming paused URLs for main domain: " + domain);
            resumed = crawl.resumeForDomain(domain);
        } else {
            resumed = crawl.resumeAll();
        }
        if (resumed > 0) out.printf("Resumed %d paused URL(s).%n", resumed);
        if (counts.pending() == 0 && resumed == 0) {
            String confirm = prompt("There are currently no pending or paused URLs. Start anyway? (y/N): ");
            return confirm != null && confirm.equalsIgnoreCase("y");
        }
        return true;
    }

    private boolean resumeSelected() throws IOException {
        String domain = crawl.primaryDomain();
        if (domain == null) {
            String answer = prompt("No main domain detected. Enter main domain to filter, or leave blank to show all paused: ");
            if (answer != null && !answer.isEmpty()) {
                crawl.setPrimaryDomain(answer);
                domain = crawl.primaryDomain();
            }
        }

        List<Url> allPaused = crawl.listPaused();
        if (allPaused.isEmpty()) {
            out.println("\nThere are no paused URLs to resume.\n");
            return false;
        }
        List<Url> paused = allPaused;
        if (domain != null) {
            var filtered = new ArrayList<Url>();
            for (Url url : allPaused) {
                if (url.isOnDomain(domain)) filtered.add(url);
            }
            if (filtered.isEmpty()) {
                out.println("(No paused URLs for main domain; showing ALL paused URLs)");
            } else {
                paused = filtered;
                out.println("(Showing paused URLs for main domain: " + domain + ")");
            }
        }

        out.printf("%nFound %d paused URL(s):%n", paused.size());
        for (int i = 0; i < paused.size(); i++) {
            out.printf("  %d) %s%n", i + 1, paused.get(i));
        }
        String selection = prompt("\nEnter number(s) to resume (comma-separated, or 'all' to resume all): ");
        if (selection == null) return false;

        int resumed = 0;
        if (selection.equalsIgnoreCase("all")) {
            for (Url url : paused) {
                if (crawl.resumeUrl(url.toString()) == Crawl.Change.APPLIED) resumed++;
            }
        } else {
            for (String part : selection.split(",")) {
                part = part.strip();
                if (part.isEmpty()) continue;
                int index;
                try {
                    index = Integer.parseInt(part);
                } catch (NumberFormatException e) {
                    out.println("Skipping invalid selection: " + part);
                    continue;
                }
                if (index < 1 || index > paused.size()) {
                    out.println("Index out of range: " + index);
                    continue;
                }
                if (crawl.resumeUrl(paused.get(index - 1).toString()) == Crawl.Change.APPLIED) resumed++;
            }
        }
        if (resumed == 0) {
            out.println("No URLs were resumed. Returning to menu.");
            return false;
        }
        out.printf("%nResumed %d URL(s).%n", resumed);
        return true;
    }

    private boolean startCrawl() {
        try {
            crawl.start();
        } catch (Crawl.BadStateException e) {
            out.println("Cannot start crawler: " + e.getMessage());
            return false;
        }
        out.println("Crawler started. Type 'help' for commands.");
        return true;
    }

    /**
     * Reads commands until the operator stops the crawl or input ends.
     */
    void commandLoop() throws IOException {
        while (true) {
            String line = prompt("> ");
            if (line == null || !execute(line)) {
                stop();
                return;
            }
        }
    }

    /**
     * Runs one command line.
     *
     * @return false if the command asks to stop
     */
    boolean execute(String line) {
        if (line.isEmpty()) return true;
        String[] parts = line.split("\\s+", 2);
        String command = parts[0].toLowerCase(Locale.ROOT);
        String arg = parts.length > 1 ? parts[1].strip() : "";

        try {
            switch (command) {
                case "quit", "stop", "exit" -> {
                    return false;
                }
                case "help" -> printHelp();
                case "seed" -> {
                    if (requireArg(arg, "seed <url>")) seed(arg);
                }
                case "pause" -> {
                    if (requireArg(arg, "pause <url>")) pause(arg);
                }
                case "pause-prefix" -> {
                    if (requireArg(arg, "pause-prefix <prefix>")) pausePrefix(arg);
                }
                case "resume" -> {
                    if (requireArg(arg, "resume <url>")) resume(arg);
                }
                case "resume-prefix" -> {
                    if (requireArg(arg, "resume-prefix <prefix>")) {
                        out.printf("Resumed %d URL(s) with prefix: %s%n", crawl.resumePrefix(arg), arg);
                    }
                }
                case "resume-all" -> out.printf("Resumed %d paused URL(s).%n", crawl.resumeAll());
                case "resume-domain" -> {
                    if (requireArg(arg, "resume-domain <domain>")) {
                        out.printf("Resumed %d paused URL(s) for domain %s%n", crawl.resumeForDomain(arg), arg);
                    }
                }
                case "list-paused" -> listPaused();
                case "list-pending" -> listPending(arg);
                case "stats" -> printStats(STATS_TOP_N);
                case "status" -> printStatus();
                default -> out.println("Unknown command: '" + command + "'. Type 'help' for list of commands.");
            }
        } catch (RuntimeException e) {
            log.error("Command failed: {}", line, e);
            out.println("Command failed: " + e.getMessage());
        }
        return true;
    }

    private boolean requireArg(String arg, String usage) {
        if (arg.isEmpty()) {
            out.println("Usage: " + usage);
            return false;
        }
        return true;
    }

    private void printHelp() {
        out.println("""
                Commands:
                  seed <url>             - add a new seed URL (page or sitemap)
                  pause <url>            - pause a single URL
                  pause-prefix <prefix>  - pause all pending URLs with given prefix
                  resume <url>           - resume a paused URL
                  resume-prefix <prefix> - resume paused URLs with prefix
                  resume-all             - resume every paused URL
                  resume-domain <domain> - resume paused URLs on a domain and its subdomains
                  list-paused            - list paused URLs
                  list-pending [prefix]  - list pending URLs
                  stats                  - show crawler statistics and top paused domains
                  status                 - show worker & URL counts
                  stop / quit            - save state and exit
                  help                   - show this help
                """);
    }

    private void seed(String url) {
        try {
            if (crawl.seed(url)) {
                out.println("Seeded URL: " + url.strip());
            } else {
                out.println("URL already known (skipped): " + url.strip());
            }
        } catch (IllegalArgumentException e) {
            out.println("Invalid URL.");
        }
    }

    private void pause(String url) {
        switch (crawl.pauseUrl(url, Crawl.DEFAULT_PAUSE_REASON)) {
            case APPLIED -> out.println("Paused URL: " + url);
            case UNKNOWN_URL -> out.println("URL not found in DB: " + url);
            case NOT_APPLICABLE -> out.println("URL is not pending: " + url);
        }
    }

    private void resume(String url) {
        switch (crawl.resumeUrl(url)) {
            case APPLIED -> out.println("Resumed URL: " + url);
            case UNKNOWN_URL -> out.println("URL not found in DB: " + url);
            case NOT_APPLICABLE -> out.println("URL is not paused: " + url);
        }
    }

    private void pausePrefix(String prefix) {
        Crawl.PrefixPause result = crawl.pausePrefix(prefix, Crawl.DEFAULT_PREFIX_PAUSE_REASON);
        out.printf("Paused %d URL(s) with prefix: %s (removed %d from in-memory queue)%n",
                result.paused(), prefix, result.dequeued());
    }

    private void listPending(String prefix) {
        List<Url> pending = crawl.listPending(prefix);
        out.printf("Found %d pending URL(s) with prefix '%s':%n", pending.size(), prefix);
        printLimited(pending);
    }

    private void listPaused() {
        List<Url> paused = crawl.listPaused();
        out.printf("Found %d paused URL(s):%n", paused.size());
        printLimited(paused);
    }

    private void printLimited(List<Url> urls) {
        for (int i = 0; i < urls.size() && i < LIST_LIMIT; i++) {
            out.println("  " + urls.get(i));
        }
        if (urls.size() > LIST_LIMIT) out.println("  ... (truncated)");
    }

    private void printStatus() {
        Crawl.Overview status = crawl.status();
        StatusCounts counts = status.counts();
        out.printf("Workers: %d | Pending: %d | Visited: %d | Paused: %d | Error: %d%n",
                status.workers(), counts.pending(), counts.visited(), counts.paused(), counts.error());
        for (Worker.Info info : crawl.workerInfo()) {
            if (info.url() != null) out.printf("  worker-%s: %s%n", info.id(), info.url());
        }
    }

    private void printStats(int topN) {
        CrawlStats stats = crawl.stats(topN);
        StatusCounts t = stats.totals();
        out.println("\n=== Crawler Stats ===");
        out.println("Total URLs: " + t.total());
        out.printf("  Pending: %d  Visited: %d  Paused: %d  Error: %d%n", t.pending(), t.visited(), t.paused(), t.error());
        out.println("Earliest seed: " + stats.earliestSeed());
        printCounts("\nTop paused domains:", stats.topPausedHosts());
        printCounts("\nTop paused prefixes (host[/first_segment]):", stats.topPausedSections());
        printCounts("\nTop domains overall:", stats.topHosts());
        out.println();
    }

    private void printCounts(String heading, List<CrawlStats.Count> counts) {
        out.println(heading);
        for (CrawlStats.Count count : counts) {
            out.printf("  %s: %d%n", count.key(), count.count());
        }
    }

    private void stop() {
        out.println("Stopping crawler... (workers will finish current tasks)");
        try {
            crawl.stop();
        } catch (Crawl.BadStateException e) {
            log.debug("Stop requested while {}", crawl.state());
        }
    }
}
