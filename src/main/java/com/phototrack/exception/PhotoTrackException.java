package com.phototrack.exception;

/**
 * A condition that aborts the whole run: missing input path, no usable photos, empty track.
 */
public class PhotoTrackException extends RuntimeException {

    public PhotoTrackException(String message) {
        super(message);
    }

    public PhotoTrackException(String message, Throwable cause) {
        super(message, cause);
    }
}
