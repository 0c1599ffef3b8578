package org.netpreserve.trawler;

import org.netpreserve.trawler.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.time.Duration;

/**
 * Fetches pages with the JDK HTTP client using a fixed User-Agent and timeout.
 */
public class HttpFetcher implements Fetcher {
    private static final Logger log = LoggerFactory.getLogger(HttpFetcher.class);
    private final HttpClient httpClient;
    private final String userAgent;
    private final Duration timeout;

    public HttpFetcher(String userAgent, Duration timeout) {
        this(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(timeout)
                .build(), userAgent, timeout);
    }

    public HttpFetcher(HttpClient httpClient, String userAgent, Duration timeout) {
        this.httpClient = httpClient;
        this.userAgent = userAgent;
        this.timeout = timeout;
    }

    @Override
    public Fetched fetch(Url url) throws IOException, InterruptedException {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(url.toString()))
                    .timeout(timeout)
                    .header("User-Agent", userAgent)
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new FetchException("Invalid URL: " + e.getMessage(), e);
        }
        long start = System.nanoTime();
        HttpResponse<byte[]> response = httpClient.send(request, BodyHandlers.ofByteArray());
        log.atDebug().addKeyValue("url", url)
                .addKeyValue("status", response.statusCode())
                .addKeyValue("timeMs", (System.nanoTime() - start) / 1_000_000)
                .log("Fetched");
        if (response.statusCode() != 200) {
            throw new FetchException(response.statusCode());
        }
        return new Fetched(url, response.statusCode(),
                response.headers().firstValue("Content-Type").orElse(""), response.body());
    }
}
