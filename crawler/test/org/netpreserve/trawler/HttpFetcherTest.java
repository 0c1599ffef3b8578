package org.netpreserve.trawler;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.netpreserve.trawler.util.Url;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class HttpFetcherTest {
    private HttpServer server;
    private String baseUrl;
    private final AtomicReference<String> userAgent = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/page", exchange -> {
            userAgent.set(exchange.getRequestHeaders().getFirst("User-Agent"));
            byte[] body = "<title>hi</title>".getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "text/html; charset=UTF-8");
            exchange.sendResponseHeaders(200, body.length);
            exchange.getResponseBody().write(body);
            exchange.close();
        });
        server.createContext("/moved", exchange -> {
            exchange.getResponseHeaders().add("Location", "/page");
            exchange.sendResponseHeaders(301, -1);
            exchange.close();
        });
        server.createContext("/missing", exchange -> {
            exchange.sendResponseHeaders(404, -1);
            exchange.close();
        });
        server.createContext("/created", exchange -> {
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
        });
        server.start();
        baseUrl = "http://" + server.getAddress().getHostString() + ":" + server.getAddress().getPort();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void testFetch() throws Exception {
        var fetcher = new HttpFetcher("TestBot/1.0", Duration.ofSeconds(5));
        Fetched fetched = fetcher.fetch(new Url(baseUrl + "/page"));

        assertEquals(200, fetched.statusCode());
        assertEquals("<title>hi</title>", new String(fetched.body(), StandardCharsets.UTF_8));
        assertEquals(StandardCharsets.UTF_8, fetched.charset());
        assertFalse(fetched.isXml());
        assertEquals("TestBot/1.0", userAgent.get());
    }

    @Test
    void testRedirectsAreFollowed() throws Exception {
        var fetcher = new HttpFetcher("TestBot/1.0", Duration.ofSeconds(5));
        Fetched fetched = fetcher.fetch(new Url(baseUrl + "/moved"));

        assertEquals(200, fetched.statusCode());
        assertEquals(new Url(baseUrl + "/moved"), fetched.url());
    }

    @Test
    void testNon200IsFailure() {
        var fetcher = new HttpFetcher("TestBot/1.0", Duration.ofSeconds(5));

        var e = assertThrows(FetchException.class, () -> fetcher.fetch(new Url(baseUrl + "/missing")));
        assertEquals("HTTP 404", e.getMessage());
        assertEquals(404, e.statusCode());

        var e2 = assertThrows(FetchException.class, () -> fetcher.fetch(new Url(baseUrl + "/created")));
        assertEquals(204, e2.statusCode());
    }

    @Test
    void testInvalidUrl() {
        var fetcher = new HttpFetcher("TestBot/1.0", Duration.ofSeconds(5));
        var e = assertThrows(FetchException.class, () -> fetcher.fetch(new Url("http://exa mple.com/")));
        assertEquals(-1, e.statusCode());
    }

    @Test
    void testCharsetParsing() {
        var url = new Url("https://example.com/");
        assertEquals(StandardCharsets.ISO_8859_1,
                new Fetched(url, 200, "text/html; charset=\"iso-8859-1\"", new byte[0]).charset());
        assertNull(new Fetched(url, 200, "text/html", new byte[0]).charset());
        assertNull(new Fetched(url, 200, "text/html; charset=bogus-charset", new byte[0]).charset());
        assertNull(new Fetched(url, 200, null, new byte[0]).charset());
        assertTrue(new Fetched(url, 200, "application/xhtml+xml", new byte[0]).isXml());
    }
}
