package com.starscape.thumbnailer.common.exception;

public class InvalidCropException extends ThumbnailerException {

    public InvalidCropException(String message) {
        super(ErrorKind.CROP, message);
    }
}
