package com.starscape.thumbnailer.features.generatethumbnails.domain;

/**
 * One requested derived image.
 *
 * @param destination optional explicit output URI; overrides the naming policy when set
 * @param crop        optional crop applied to the full-resolution source before resizing
 * @param width       target width, {@code 0} to derive it from the height
 * @param height      target height, {@code 0} to derive it from the width
 */
public record ThumbnailOption(String destination, CropRectangle crop, int width, int height) {

    public ThumbnailOption {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Thumbnail width and height must not be negative: " + width + "x" + height);
        }
        if (destination != null && destination.isBlank()) {
            destination = null;
        }
    }

    public static ThumbnailOption ofSize(int width, int height) {
        return new ThumbnailOption(null, null, width, height);
    }

    public boolean hasExplicitDestination() {
        return destination != null;
    }

    public boolean hasCrop() {
        return crop != null;
    }

    /**
     * {@code 0x0} asks for no resize at all: the (possibly cropped) image is passed through.
     */
    public boolean isPassthrough() {
        return width == 0 && height == 0;
    }
}
