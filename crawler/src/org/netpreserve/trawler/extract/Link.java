package org.netpreserve.trawler.extract;

import org.netpreserve.trawler.util.Url;

/**
 * A URL discovered in fetched content.
 *
 * @param url     the normalized absolute URL
 * @param sitemap true if it was listed in a sitemap index and so is itself a sitemap
 */
public record Link(Url url, boolean sitemap) {
}
