package com.starscape.thumbnailer.common.exception;

import java.net.URI;

/**
 * Read or write failure of a backing store, local or remote.
 */
public class StoreIOException extends ThumbnailerException {

    private final URI location;
    private final boolean notFound;

    public StoreIOException(URI location, String message, Throwable cause) {
        this(location, message, cause, false);
    }

    public StoreIOException(URI location, String message, Throwable cause, boolean notFound) {
        super(ErrorKind.IO, message + ": " + location, cause);
        this.location = location;
        this.notFound = notFound;
    }

    public URI getLocation() {
        return location;
    }

    public boolean isNotFound() {
        return notFound;
    }
}
