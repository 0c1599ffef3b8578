package org.netpreserve.trawler.extract;

import org.jetbrains.annotations.Nullable;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.netpreserve.trawler.util.Url;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Pulls the title, visible text and outbound links from an HTML page.
 */
public class HtmlExtractor {

    public record Extracted(String title, String text, List<Url> links) {
    }

    /**
     * @param charset the charset from the response headers, or null to let the parser detect it
     */
    public Extracted extract(Url baseUrl, byte[] body, @Nullable Charset charset) throws IOException {
        Document document = Jsoup.parse(new ByteArrayInputStream(body),
                charset == null ? null : charset.name(), baseUrl.toString());

        var links = new LinkedHashSet<Url>();
        for (Element anchor : document.select("a[href]")) {
            // abs: resolves against the base URL and gives "" when that is impossible
            Url link = Url.normalize(anchor.attr("abs:href"));
            if (link == null) continue;
            link = link.withoutFragment();
            if (!link.isHttp()) continue;
            links.add(link);
        }

        return new Extracted(document.title().strip(), document.text(), new ArrayList<>(links));
    }
}
