package com.starscape.thumbnailer.features.generatethumbnails.infra.codec;

import com.starscape.thumbnailer.common.exception.UnsupportedFormatException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Image formats the service reads and writes, keyed by lower-case file extension.
 */
public enum ImageFormat {
    JPEG("jpeg", "image/jpeg", ".jpg", ".jpeg"),
    PNG("png", "image/png", ".png"),
    GIF("gif", "image/gif", ".gif"),
    TIFF("tiff", "image/tiff", ".tif", ".tiff"),
    BMP("bmp", "image/bmp", ".bmp");

    private final String formatName;
    private final String mimeType;
    private final List<String> extensions;

    ImageFormat(String formatName, String mimeType, String... extensions) {
        this.formatName = formatName;
        this.mimeType = mimeType;
        this.extensions = List.of(extensions);
    }

    /**
     * ImageIO format name.
     */
    public String getFormatName() {
        return formatName;
    }

    public String getMimeType() {
        return mimeType;
    }

    public List<String> getExtensions() {
        return extensions;
    }

    public static Optional<ImageFormat> fromExtension(String extension) {
        if (extension == null || extension.isEmpty()) {
            return Optional.empty();
        }
        String normalized = extension.toLowerCase(Locale.ROOT);
        if (!normalized.startsWith(".")) {
            normalized = "." + normalized;
        }
        String ext = normalized;
        return Arrays.stream(values())
                .filter(format -> format.extensions.contains(ext))
                .findFirst();
    }

    /**
     * Format of the file a path points to.
     *
     * @throws UnsupportedFormatException when the extension is missing or not recognized
     */
    public static ImageFormat forPath(String path) {
        return fromExtension(extensionOf(path))
                .orElseThrow(() -> new UnsupportedFormatException(path));
    }

    /**
     * Extension of the last path element including the dot, in lower case, or an empty
     * string when there is none.
     */
    public static String extensionOf(String path) {
        if (path == null) {
            return "";
        }
        int lastSlash = path.lastIndexOf('/');
        int lastDot = path.lastIndexOf('.');
        if (lastDot <= lastSlash) {
            return "";
        }
        return path.substring(lastDot).toLowerCase(Locale.ROOT);
    }
}
