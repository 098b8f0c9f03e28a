package com.starscape.thumbnailer.features.generatethumbnails.infra.codec;

import com.starscape.thumbnailer.common.config.ThumbnailerProperties;
import com.starscape.thumbnailer.common.exception.ImageDecodeException;
import com.starscape.thumbnailer.common.exception.ImageEncodeException;
import com.starscape.thumbnailer.common.exception.UnsupportedFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.plugins.tiff.BaselineTIFFTagSet;
import javax.imageio.plugins.tiff.TIFFDirectory;
import javax.imageio.plugins.tiff.TIFFField;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DirectColorModel;
import java.awt.image.SinglePixelPackedSampleModel;
import java.awt.image.WritableRaster;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Iterator;

/**
 * Decodes and encodes images with ImageIO, choosing the format from a file extension.
 *
 * <p>Encoding parameters are fixed per format:
 * <ul>
 *   <li>JPEG: quality 75</li>
 *   <li>GIF: 256-colour palette (the ImageIO GIF writer quantizes true-colour images to 256 entries)</li>
 *   <li>TIFF: lossless Deflate compression with the horizontal differencing predictor</li>
 *   <li>PNG, BMP: writer defaults</li>
 * </ul>
 */
@Component
public class ImageCodec {

    private static final Logger log = LoggerFactory.getLogger(ImageCodec.class);

    static final float JPEG_QUALITY = 0.75f;
    static final String TIFF_COMPRESSION = "Deflate";

    private final String preferredJpegReader;

    public ImageCodec(ThumbnailerProperties properties) {
        String readerClass = properties.getCodec().getJpegReaderClass();
        this.preferredJpegReader = readerClass == null || readerClass.isBlank() ? null : readerClass.trim();
    }

    /**
     * Decode an image. The extension must name a supported format; the bytes themselves
     * are sniffed, except for JPEG when a preferred JPEG reader is configured and installed.
     *
     * @throws UnsupportedFormatException when the extension is not supported
     * @throws ImageDecodeException when the bytes cannot be decoded
     */
    public BufferedImage decode(InputStream input, String extension) {
        ImageFormat format = ImageFormat.fromExtension(extension)
                .orElseThrow(() -> new UnsupportedFormatException(extension));

        BufferedImage image;
        try (ImageInputStream stream = ImageIO.createImageInputStream(input)) {
            if (stream == null) {
                throw new IOException("No image input stream available");
            }
            ImageReader reader = selectReader(format, stream);
            if (reader == null) {
                throw new IOException("Unrecognized image data");
            }
            try {
                reader.setInput(stream, true, true);
                image = reader.read(0);
            } finally {
                reader.dispose();
            }
        } catch (IOException | RuntimeException e) {
            throw new ImageDecodeException("Failed to decode " + format + " image: " + e.getMessage(), e);
        }
        if (image == null) {
            throw new ImageDecodeException("Failed to decode " + format + " image");
        }
        return image;
    }

    public byte[] encode(BufferedImage image, ImageFormat format) {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        encode(image, format, output);
        return output.toByteArray();
    }

    /**
     * Encode an image to the given stream. The stream is not closed.
     *
     * @throws ImageEncodeException when the writer fails or rejects the image
     */
    public void encode(BufferedImage image, ImageFormat format, OutputStream output) {
        try {
            switch (format) {
                case JPEG -> writeJpeg(jpegSource(image), output);
                case PNG, GIF -> write(image, format, output);
                case TIFF -> writeTiff(image, output);
                case BMP -> write(withoutAlpha(image), format, output);
            }
        } catch (IOException e) {
            throw new ImageEncodeException("Failed to encode " + format + " image: " + e.getMessage(), e);
        }
    }

    private ImageReader selectReader(ImageFormat format, ImageInputStream stream) {
        if (format == ImageFormat.JPEG && preferredJpegReader != null) {
            Iterator<ImageReader> readers = ImageIO.getImageReadersByFormatName(format.getFormatName());
            while (readers.hasNext()) {
                ImageReader reader = readers.next();
                if (reader.getClass().getName().equals(preferredJpegReader)) {
                    return reader;
                }
            }
            log.debug("Preferred JPEG reader {} is not installed, using default", preferredJpegReader);
        }
        Iterator<ImageReader> readers = ImageIO.getImageReaders(stream);
        return readers.hasNext() ? readers.next() : null;
    }

    /**
     * JPEG has no alpha channel. An opaque ARGB image is handed to the writer as an RGB view
     * over the same pixel buffer; anything else with alpha is flattened into a copy.
     */
    BufferedImage jpegSource(BufferedImage image) {
        if (!image.getColorModel().hasAlpha()) {
            return image;
        }
        if (canShareAsRgb(image) && isOpaque(image)) {
            WritableRaster rgb = image.getRaster().createWritableChild(
                    0, 0, image.getWidth(), image.getHeight(), 0, 0, new int[] {0, 1, 2});
            DirectColorModel colorModel = new DirectColorModel(24, 0x00ff0000, 0x0000ff00, 0x000000ff);
            return new BufferedImage(colorModel, rgb, false, null);
        }
        return withoutAlpha(image);
    }

    private boolean canShareAsRgb(BufferedImage image) {
        WritableRaster raster = image.getRaster();
        return image.getType() == BufferedImage.TYPE_INT_ARGB
                && raster.getSampleModel() instanceof SinglePixelPackedSampleModel
                && raster.getSampleModelTranslateX() == 0
                && raster.getSampleModelTranslateY() == 0;
    }

    private boolean isOpaque(BufferedImage image) {
        WritableRaster raster = image.getRaster();
        int width = raster.getWidth();
        int[] alpha = new int[width];
        for (int y = 0; y < raster.getHeight(); y++) {
            raster.getSamples(0, y, width, 1, 3, alpha);
            for (int a : alpha) {
                if (a != 0xff) {
                    return false;
                }
            }
        }
        return true;
    }

    private BufferedImage withoutAlpha(BufferedImage image) {
        if (!image.getColorModel().hasAlpha()) {
            return image;
        }
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    private void writeJpeg(BufferedImage image, OutputStream output) throws IOException {
        ImageWriter writer = writerFor(ImageFormat.JPEG);
        ImageWriteParam param = writer.getDefaultWriteParam();
        param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
        param.setCompressionQuality(JPEG_QUALITY);
        writeWith(writer, new IIOImage(image, null, null), param, output);
    }

    private void writeTiff(BufferedImage image, OutputStream output) throws IOException {
        ImageWriter writer = writerFor(ImageFormat.TIFF);
        ImageWriteParam param = writer.getDefaultWriteParam();
        param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
        param.setCompressionType(TIFF_COMPRESSION);

        IIOMetadata defaults = writer.getDefaultImageMetadata(ImageTypeSpecifier.createFromRenderedImage(image), param);
        TIFFDirectory directory = TIFFDirectory.createFromMetadata(defaults);
        directory.addTIFFField(new TIFFField(
                BaselineTIFFTagSet.getInstance().getTag(BaselineTIFFTagSet.TAG_PREDICTOR),
                BaselineTIFFTagSet.PREDICTOR_HORIZONTAL_DIFFERENCING));

        writeWith(writer, new IIOImage(image, null, directory.getAsMetadata()), param, output);
    }

    private void write(BufferedImage image, ImageFormat format, OutputStream output) throws IOException {
        ImageWriter writer = writerFor(format);
        writeWith(writer, new IIOImage(image, null, null), writer.getDefaultWriteParam(), output);
    }

    private void writeWith(ImageWriter writer, IIOImage image, ImageWriteParam param, OutputStream output)
            throws IOException {
        try (ImageOutputStream stream = ImageIO.createImageOutputStream(output)) {
            writer.setOutput(stream);
            writer.write(null, image, param);
            stream.flush();
        } finally {
            writer.dispose();
        }
    }

    private ImageWriter writerFor(ImageFormat format) {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(format.getFormatName());
        if (!writers.hasNext()) {
            throw new ImageEncodeException("No ImageIO writer installed for " + format);
        }
        return writers.next();
    }
}
