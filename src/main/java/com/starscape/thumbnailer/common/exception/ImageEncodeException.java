package com.starscape.thumbnailer.common.exception;

/**
 * Raised when an image writer rejects the image it was given.
 */
public class ImageEncodeException extends ThumbnailerException {

    public ImageEncodeException(String message) {
        super(ErrorKind.FORMAT, message);
    }

    public ImageEncodeException(String message, Throwable cause) {
        super(ErrorKind.FORMAT, message, cause);
    }
}
