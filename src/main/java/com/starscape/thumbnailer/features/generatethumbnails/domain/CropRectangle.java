package com.starscape.thumbnailer.features.generatethumbnails.domain;

import java.awt.Rectangle;

/**
 * Axis-aligned crop in source-pixel coordinates, given by its min and max corners.
 * The max corner is exclusive.
 */
public record CropRectangle(int minX, int minY, int maxX, int maxY) {

    /**
     * Convert to an AWT rectangle, swapping corners given in the wrong order.
     */
    public Rectangle toRectangle() {
        int x0 = Math.min(minX, maxX);
        int y0 = Math.min(minY, maxY);
        int x1 = Math.max(minX, maxX);
        int y1 = Math.max(minY, maxY);
        return new Rectangle(x0, y0, x1 - x0, y1 - y0);
    }

    @Override
    public String toString() {
        return "min: [" + minX + " " + minY + "], max: [" + maxX + " " + maxY + "]";
    }
}
