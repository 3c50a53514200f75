package com.phototrack.exception;

/**
 * Failure of a single provider call (timeout, non-2xx status, unreadable payload).
 * Never escapes the resolver; it only marks a tier as failed.
 */
public class GeocodingException extends RuntimeException {

    public GeocodingException(String message) {
        super(message);
    }

    public GeocodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
