package com.logcount.upstream;

/**
 * The upstream log source could not deliver a page: network, authentication, an error
 * status in the response body, or pagination that never terminated.
 */
public class UpstreamFetchException extends RuntimeException {

    public UpstreamFetchException(String message) {
        super(message);
    }

    public UpstreamFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
