package com.starscape.thumbnailer.features.generatethumbnails.domain;

import java.awt.image.BufferedImage;

public record ImageSize(int width, int height) {

    public static ImageSize of(BufferedImage image) {
        return new ImageSize(image.getWidth(), image.getHeight());
    }

    public boolean matches(BufferedImage image) {
        return image.getWidth() == width && image.getHeight() == height;
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
