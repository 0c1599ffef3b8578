package org.netpreserve.trawler;

import java.io.IOException;

/**
 * A fetch that reached the server but did not succeed.
 */
public class FetchException extends IOException {
    private final int statusCode;

    public FetchException(int statusCode) {
        super("HTTP " + statusCode);
        this.statusCode = statusCode;
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * The HTTP status code, or -1 if the request was never sent.
     */
    public int statusCode() {
        return statusCode;
    }
}
