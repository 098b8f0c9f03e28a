package com.starscape.thumbnailer.common.exception;

/**
 * A source, folder or destination string that is not a usable URI.
 */
public class InvalidLocationException extends ThumbnailerException {

    public InvalidLocationException(String location, Throwable cause) {
        super(ErrorKind.PATH, "Malformed location '" + location + "'", cause);
    }

    public InvalidLocationException(String message) {
        super(ErrorKind.PATH, message);
    }
}
