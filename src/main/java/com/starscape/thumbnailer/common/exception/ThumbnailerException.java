package com.starscape.thumbnailer.common.exception;

/**
 * Base class of every error raised while opening, transforming or saving images.
 * None of these are retried by the service itself.
 */
public abstract class ThumbnailerException extends RuntimeException {

    private final ErrorKind kind;

    protected ThumbnailerException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected ThumbnailerException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
