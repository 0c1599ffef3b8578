package org.netpreserve.trawler.extract;

import org.netpreserve.trawler.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.zip.GZIPInputStream;

/**
 * Extracts URLs from XML sitemaps and sitemap indexes.
 * <p>
 * The root element decides the format, compared by local name so any namespace prefix is ignored. A sitemap
 * index yields its {@code sitemap/loc} entries flagged as sitemaps, a urlset yields its {@code url/loc} entries.
 * Anything else, including XML that fails to parse, yields nothing and is only logged.
 */
public class SitemapParser {
    private static final Logger log = LoggerFactory.getLogger(SitemapParser.class);
    private final DocumentBuilderFactory factory;

    public SitemapParser() {
        factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setExpandEntityReferences(false);
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure processing", e);
        }
    }

    public List<Link> parse(Url url, byte[] body) {
        if (url.isGzip()) {
            body = gunzipOrRaw(url, body);
        }

        Document document;
        try {
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new ParseErrorHandler());
            document = builder.parse(new ByteArrayInputStream(body));
        } catch (SAXException | IOException e) {
            log.warn("Failed to parse sitemap {}: {}", url, e.getMessage());
            return List.of();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException(e);
        }

        Element root = document.getDocumentElement();
        String rootName = localName(root).toLowerCase(Locale.ROOT);
        if (rootName.equals("sitemapindex")) {
            List<Link> links = extractLocs(root, "sitemap", true);
            log.info("Parsed sitemap index {} -> {} sitemap(s)", url, links.size());
            return links;
        } else if (rootName.equals("urlset")) {
            List<Link> links = extractLocs(root, "url", false);
            log.info("Parsed sitemap {} -> {} URL(s)", url, links.size());
            return links;
        } else {
            log.warn("Unrecognized XML root in {}: {}", url, root.getTagName());
            return List.of();
        }
    }

    /**
     * Decompresses gzip content. Servers often serve {@code .xml.gz} already decoded, so bytes that are not gzip
     * are returned unchanged.
     */
    private static byte[] gunzipOrRaw(Url url, byte[] body) {
        try (var stream = new GZIPInputStream(new ByteArrayInputStream(body))) {
            return stream.readAllBytes();
        } catch (IOException e) {
            log.debug("{} is not gzip compressed, parsing as plain XML: {}", url, e.getMessage());
            return body;
        }
    }

    private static List<Link> extractLocs(Element root, String entryName, boolean sitemap) {
        var links = new ArrayList<Link>();
        for (Node entry = root.getFirstChild(); entry != null; entry = entry.getNextSibling()) {
            if (!(entry instanceof Element element) || !localName(element).equals(entryName)) continue;
            Element loc = firstChildElement(element, "loc");
            if (loc == null) continue;
            Url locUrl = Url.normalize(loc.getTextContent());
            if (locUrl == null) continue;
            links.add(new Link(locUrl, sitemap));
        }
        return links;
    }

    private static Element firstChildElement(Element parent, String name) {
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child instanceof Element element && localName(element).equals(name)) {
                return element;
            }
        }
        return null;
    }

    private static String localName(Element element) {
        String name = element.getLocalName();
        return name != null ? name : element.getTagName();
    }

    private static class ParseErrorHandler implements ErrorHandler {
        @Override
        public void warning(SAXParseException exception) {
            log.debug("Sitemap parser warning: {}", exception.getMessage());
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    }
}
