package com.starscape.thumbnailer.features.generatethumbnails.domain;

import java.net.URI;

/**
 * Outcome of one option. Exactly one of {@code thumbnail} and {@code error} is set.
 */
public record ThumbnailResult(ThumbnailOption option, URI thumbnail, RuntimeException error) {

    public static ThumbnailResult success(ThumbnailOption option, URI thumbnail) {
        return new ThumbnailResult(option, thumbnail, null);
    }

    public static ThumbnailResult failure(ThumbnailOption option, RuntimeException error) {
        return new ThumbnailResult(option, null, error);
    }

    public boolean succeeded() {
        return error == null;
    }
}
