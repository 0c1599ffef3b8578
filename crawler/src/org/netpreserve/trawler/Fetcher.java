package org.netpreserve.trawler;

import org.netpreserve.trawler.util.Url;

import java.io.IOException;

/**
 * Retrieves a URL. Implementations return only successful (HTTP 200) responses and signal everything else with an
 * {@link IOException}.
 */
public interface Fetcher {
    Fetched fetch(Url url) throws IOException, InterruptedException;
}
