package com.starscape.thumbnailer.features.generatethumbnails.domain;

import com.starscape.thumbnailer.common.exception.InvalidLocationException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;

/**
 * One thumbnail generation request: a source image, a default destination folder
 * and the derived images to produce from it.
 * Locations are kept as given and parsed on use, so a malformed destination only fails
 * the options that depend on it.
 */
public record ThumbnailJob(
    String sourceImage,
    String destinationFolder,
    boolean deleteSourceOnSuccess,
    List<ThumbnailOption> options
) {

    public ThumbnailJob {
        options = options == null ? List.of() : List.copyOf(options);
    }

    public URI sourceUri() {
        return parseLocation(sourceImage);
    }

    public URI destinationFolderUri() {
        return parseLocation(destinationFolder);
    }

    public static URI parseLocation(String location) {
        if (location == null || location.isBlank()) {
            throw new InvalidLocationException("Location is missing");
        }
        try {
            return new URI(location.trim());
        } catch (URISyntaxException e) {
            throw new InvalidLocationException(location, e);
        }
    }
}
