package com.starscape.thumbnailer.common.exception;

public class ImageDecodeException extends ThumbnailerException {

    public ImageDecodeException(String message) {
        super(ErrorKind.DECODE, message);
    }

    public ImageDecodeException(String message, Throwable cause) {
        super(ErrorKind.DECODE, message, cause);
    }
}
