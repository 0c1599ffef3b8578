package org.netpreserve.trawler.extract;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * The outcome of handling one fetched document.
 *
 * @param sitemap whether the document was handled as a sitemap
 * @param links   URLs to register in the frontier
 * @param page    content record for HTML pages, null for sitemaps
 */
public record Dispatch(boolean sitemap, List<Link> links, @Nullable PageRecord page) {
}
