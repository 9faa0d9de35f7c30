package com.logcount.model;

/**
 * Raised when a count request is rejected before it reaches the cache:
 * blank query text, missing bounds, or an end that is not after the start.
 */
public class MalformedRequestException extends IllegalArgumentException {

    public MalformedRequestException(String message) {
        super(message);
    }
}
