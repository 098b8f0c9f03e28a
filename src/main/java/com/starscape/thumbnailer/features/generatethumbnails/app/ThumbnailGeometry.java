package com.starscape.thumbnailer.features.generatethumbnails.app;

import com.starscape.thumbnailer.features.generatethumbnails.domain.ImageSize;
import com.starscape.thumbnailer.features.generatethumbnails.domain.ThumbnailOption;

import java.util.List;
import java.util.Optional;

/**
 * Size arithmetic shared by the generation steps.
 */
public final class ThumbnailGeometry {

    private ThumbnailGeometry() {
    }

    /**
     * Resolve the output size of an option against the image it will be produced from.
     * A zero dimension keeps the aspect ratio of {@code source} (never below 1px);
     * {@code 0x0} keeps the source size.
     *
     * @throws IllegalArgumentException when the derived dimension does not fit in an int
     */
    public static ImageSize resolve(ThumbnailOption option, ImageSize source) {
        int width = option.width();
        int height = option.height();
        if (width == 0 && height == 0) {
            return source;
        }
        if (width == 0) {
            width = scale(option, height, source.width(), source.height());
        }
        if (height == 0) {
            height = scale(option, width, source.height(), source.width());
        }
        return new ImageSize(width, height);
    }

    /**
     * Component-wise maximum of the resolved sizes of the options that resize the
     * uncropped source. Empty when no option does.
     */
    public static Optional<ImageSize> sharedBox(List<ThumbnailOption> options, ImageSize source) {
        int maxWidth = 0;
        int maxHeight = 0;
        for (ThumbnailOption option : options) {
            if (option.hasCrop() || option.isPassthrough()) {
                continue;
            }
            ImageSize size = resolve(option, source);
            maxWidth = Math.max(maxWidth, size.width());
            maxHeight = Math.max(maxHeight, size.height());
        }
        if (maxWidth == 0) {
            return Optional.empty();
        }
        return Optional.of(new ImageSize(maxWidth, maxHeight));
    }

    private static int scale(ThumbnailOption option, int other, int sourceOpposite, int sourceSame) {
        long derived = Math.max(1L, Math.round((double) other * sourceOpposite / sourceSame));
        if (derived > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Thumbnail size " + option.width() + "x" + option.height()
                    + " derives a dimension of " + derived + " pixels, which is too large");
        }
        return (int) derived;
    }
}
