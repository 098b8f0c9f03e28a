package com.starscape.thumbnailer.common.exception;

/**
 * Category of a thumbnailing failure. Used for logging and for mapping errors to HTTP statuses.
 */
public enum ErrorKind {
    SCHEME,
    FORMAT,
    DECODE,
    IO,
    PATH,
    CROP,
    UNSUPPORTED_OPERATION
}
