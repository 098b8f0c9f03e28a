package com.starscape.thumbnailer.common.exception;

import java.net.URI;

/**
 * Deleting images is only defined for the local filesystem.
 */
public class DeleteNotSupportedException extends ThumbnailerException {

    public DeleteNotSupportedException(URI location) {
        super(ErrorKind.UNSUPPORTED_OPERATION, "Delete is not supported for " + location);
    }
}
