package com.starscape.thumbnailer.features.generatethumbnails.infra.store;

import java.net.URI;
import java.util.Arrays;
import java.util.Optional;

/**
 * URI schemes with a registered image store. Adding a backend means adding a constant here
 * and a case in {@link ImageStoreResolver}.
 */
public enum StoreScheme {
    FILE("file"),
    S3("s3");

    private final String scheme;

    StoreScheme(String scheme) {
        this.scheme = scheme;
    }

    public String getScheme() {
        return scheme;
    }

    public static Optional<StoreScheme> of(URI location) {
        String scheme = location.getScheme();
        if (scheme == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(candidate -> candidate.scheme.equalsIgnoreCase(scheme))
                .findFirst();
    }
}
