package org.netpreserve.trawler.extract;

import org.netpreserve.trawler.Fetched;
import org.netpreserve.trawler.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;

/**
 * Decides whether a fetched document is a sitemap or an HTML page and extracts its links accordingly.
 */
public class ContentDispatcher {
    private static final Logger log = LoggerFactory.getLogger(ContentDispatcher.class);
    private static final int SNIPPET_LENGTH = 200;
    private final SitemapParser sitemapParser;
    private final HtmlExtractor htmlExtractor;

    public ContentDispatcher() {
        this(new SitemapParser(), new HtmlExtractor());
    }

    public ContentDispatcher(SitemapParser sitemapParser, HtmlExtractor htmlExtractor) {
        this.sitemapParser = sitemapParser;
        this.htmlExtractor = htmlExtractor;
    }

    public static boolean isSitemap(Fetched fetched) {
        return fetched.url().looksLikeSitemap() || fetched.isXml();
    }

    /**
     * @throws IOException if an HTML body cannot be decoded
     */
    public Dispatch dispatch(Fetched fetched) throws IOException {
        Url url = fetched.url();
        if (isSitemap(fetched)) {
            return new Dispatch(true, sitemapParser.parse(url, fetched.body()), null);
        }

        var extracted = htmlExtractor.extract(url, fetched.body(), fetched.charset());
        String text = extracted.text();
        String snippet = text.length() > SNIPPET_LENGTH ? text.substring(0, SNIPPET_LENGTH) : text;
        log.info("[CONTENT] {} :: {} chars, snippet: {}", url, text.length(), snippet);

        var links = new ArrayList<Link>(extracted.links().size());
        for (Url link : extracted.links()) {
            links.add(new Link(link, false));
        }
        var page = PageRecord.of(url.toString(), extracted.title(), fetched.statusCode(), text);
        return new Dispatch(false, links, page);
    }
}
