package com.starscape.thumbnailer.features.generatethumbnails.app;

import com.starscape.thumbnailer.common.exception.InvalidCropException;
import com.starscape.thumbnailer.features.generatethumbnails.domain.CropRectangle;
import com.starscape.thumbnailer.features.generatethumbnails.domain.ImageSize;
import net.coobird.thumbnailator.Thumbnails;
import net.coobird.thumbnailator.resizers.configurations.ScalingMode;
import org.springframework.stereotype.Component;

import java.awt.AlphaComposite;
import java.awt.Graphics2D;
import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.WritableRaster;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Pixel operations on decoded images. Inputs are never written to, so one decoded
 * source can be shared by all options of a job.
 */
@Component
public class ImageTransformer {

    /**
     * The representation every later step works on: 8-bit, non-premultiplied ARGB.
     * Returns the image itself when it already is in that form.
     */
    public BufferedImage toCanonical(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_ARGB) {
            return image;
        }
        BufferedImage canonical = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = canonical.createGraphics();
        try {
            g.setComposite(AlphaComposite.Src);
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return canonical;
    }

    /**
     * Crop to the part of the rectangle that lies inside the image.
     * The result is a view sharing the source pixels and must not be written to.
     */
    public BufferedImage crop(BufferedImage image, CropRectangle crop) {
        Rectangle bounds = new Rectangle(0, 0, image.getWidth(), image.getHeight());
        Rectangle region = crop.toRectangle().intersection(bounds);
        if (region.isEmpty()) {
            throw new InvalidCropException("Crop " + crop + " is outside the "
                    + image.getWidth() + "x" + image.getHeight() + " image");
        }
        return image.getSubimage(region.x, region.y, region.width, region.height);
    }

    /**
     * Resize to exactly {@code size} with a bicubic filter, ignoring the aspect ratio.
     * Always returns a new image; a resize to the current size is a plain copy.
     */
    public BufferedImage resize(BufferedImage image, ImageSize size) {
        if (size.matches(image)) {
            return copy(image);
        }
        try {
            return Thumbnails.of(image)
                    .forceSize(size.width(), size.height())
                    .scalingMode(ScalingMode.BICUBIC)
                    .imageType(BufferedImage.TYPE_INT_ARGB)
                    .asBufferedImage();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to resize image to " + size, e);
        }
    }

    public BufferedImage copy(BufferedImage image) {
        ColorModel colorModel = image.getColorModel();
        WritableRaster raster = image.copyData(
                image.getRaster().createCompatibleWritableRaster(image.getWidth(), image.getHeight()));
        return new BufferedImage(colorModel, raster, colorModel.isAlphaPremultiplied(), null);
    }
}
