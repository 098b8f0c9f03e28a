package com.starscape.thumbnailer.features.generatethumbnails.infra.store;

import com.starscape.thumbnailer.common.exception.DeleteNotSupportedException;

import java.awt.image.BufferedImage;
import java.net.URI;

/**
 * Reads and writes the image at one location of a backing store.
 * Instances are bound to a single URI, hold no other state and are not shared between calls.
 */
public interface ImageStore {

    URI location();

    /**
     * Read and decode the image.
     */
    BufferedImage open();

    /**
     * Encode the image in the format named by the location's extension and write it.
     * A failed save leaves no partial image behind.
     */
    void save(BufferedImage image);

    /**
     * Remove the image. Only some stores support this; the others fail loudly.
     */
    default void delete() {
        throw new DeleteNotSupportedException(location());
    }
}
