package com.starscape.thumbnailer.common.exception;

public class UnsupportedFormatException extends ThumbnailerException {

    public UnsupportedFormatException(String path) {
        super(ErrorKind.FORMAT, "Unsupported image format for: " + path);
    }
}
