package com.starscape.thumbnailer.common.config;

/**
 * How an option without crop and without resize is named when it has no explicit destination.
 */
public enum PassthroughNaming {

    /**
     * {@code {base}}: the source name without any extension. Historical behavior; the output
     * cannot be saved by a store that derives the format from the extension.
     */
    BASE_NAME,

    /**
     * {@code {base}{ext}}.
     */
    KEEP_EXTENSION,

    /**
     * {@code {base}_s{width}x{height}{ext}} with the source dimensions.
     */
    SIZED
}
