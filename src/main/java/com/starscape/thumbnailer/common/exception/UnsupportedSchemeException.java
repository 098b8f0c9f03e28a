package com.starscape.thumbnailer.common.exception;

import java.net.URI;

/**
 * Raised when a location uses a scheme no image store is registered for.
 */
public class UnsupportedSchemeException extends ThumbnailerException {

    private final URI location;

    public UnsupportedSchemeException(URI location) {
        super(ErrorKind.SCHEME, "No image store for URI: " + location);
        this.location = location;
    }

    public URI getLocation() {
        return location;
    }
}
