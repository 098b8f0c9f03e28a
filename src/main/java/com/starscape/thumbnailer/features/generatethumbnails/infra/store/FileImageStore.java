package com.starscape.thumbnailer.features.generatethumbnails.infra.store;

import com.starscape.thumbnailer.common.exception.InvalidLocationException;
import com.starscape.thumbnailer.common.exception.StoreIOException;
import com.starscape.thumbnailer.features.generatethumbnails.infra.codec.ImageCodec;
import com.starscape.thumbnailer.features.generatethumbnails.infra.codec.ImageFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Image store over the local filesystem; the URI path is the file path.
 * Saves go through a temporary file in the target directory that is moved into place
 * once the image is fully encoded.
 */
public class FileImageStore implements ImageStore {

    private static final Logger log = LoggerFactory.getLogger(FileImageStore.class);

    private final URI location;
    private final Path path;
    private final ImageCodec codec;

    public FileImageStore(URI location, ImageCodec codec) {
        if (location.getPath() == null || location.getPath().isEmpty()) {
            throw new InvalidLocationException("File URI has no path: " + location);
        }
        this.location = location;
        this.path = Path.of(location.getPath());
        this.codec = codec;
    }

    @Override
    public URI location() {
        return location;
    }

    @Override
    public BufferedImage open() {
        try (InputStream input = Files.newInputStream(path)) {
            return codec.decode(input, ImageFormat.extensionOf(path.toString()));
        } catch (NoSuchFileException e) {
            throw new StoreIOException(location, "Image not found", e, true);
        } catch (IOException e) {
            throw new StoreIOException(location, "Failed to read image", e);
        }
    }

    @Override
    public void save(BufferedImage image) {
        ImageFormat format = ImageFormat.forPath(path.toString());
        Path directory = path.toAbsolutePath().getParent();
        Path temp = null;
        try {
            temp = Files.createTempFile(directory, "." + path.getFileName(), ".tmp");
            try (OutputStream output = Files.newOutputStream(temp)) {
                codec.encode(image, format, output);
            }
            moveIntoPlace(temp);
            temp = null;
        } catch (IOException e) {
            throw new StoreIOException(location, "Failed to write image", e);
        } finally {
            if (temp != null) {
                discard(temp);
            }
        }
    }

    @Override
    public void delete() {
        try {
            Files.delete(path);
        } catch (NoSuchFileException e) {
            throw new StoreIOException(location, "Image not found", e, true);
        } catch (IOException e) {
            throw new StoreIOException(location, "Failed to delete image", e);
        }
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void discard(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to remove temporary file {}", temp, e);
        }
    }
}
