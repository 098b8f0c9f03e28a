package com.starscape.thumbnailer.features.generatethumbnails.infra.store;

import com.starscape.thumbnailer.common.config.ThumbnailerProperties;
import com.starscape.thumbnailer.common.exception.StoreIOException;
import com.starscape.thumbnailer.common.exception.UnsupportedFormatException;
import com.starscape.thumbnailer.features.generatethumbnails.infra.codec.ImageCodec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileImageStoreTest {

    private final ImageCodec codec = new ImageCodec(new ThumbnailerProperties());

    @TempDir
    Path tempDir;

    private FileImageStore store(Path path) {
        return new FileImageStore(path.toUri(), codec);
    }

    private static long entries(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.count();
        }
    }

    @Test
    void shouldSaveAndOpenImage() {
        Path target = tempDir.resolve("out.png");
        BufferedImage image = new BufferedImage(12, 7, BufferedImage.TYPE_INT_ARGB);
        image.setRGB(2, 3, 0xff00ff00);

        store(target).save(image);
        BufferedImage reopened = store(target).open();

        assertTrue(Files.exists(target));
        assertEquals(12, reopened.getWidth());
        assertEquals(7, reopened.getHeight());
        assertEquals(0xff00ff00, reopened.getRGB(2, 3));
    }

    @Test
    void shouldReplaceExistingFile() throws IOException {
        Path target = tempDir.resolve("out.bmp");
        store(target).save(new BufferedImage(4, 4, BufferedImage.TYPE_INT_ARGB));
        store(target).save(new BufferedImage(9, 5, BufferedImage.TYPE_INT_ARGB));

        assertEquals(9, store(target).open().getWidth());
        assertEquals(1, entries(tempDir));
    }

    @Test
    void shouldLeaveNothingBehindForUnsupportedExtension() throws IOException {
        Path target = tempDir.resolve("out.webp");

        assertThrows(UnsupportedFormatException.class,
                () -> store(target).save(new BufferedImage(4, 4, BufferedImage.TYPE_INT_ARGB)));
        assertEquals(0, entries(tempDir));
    }

    @Test
    void shouldFailToSaveIntoMissingDirectory() {
        Path target = tempDir.resolve("missing").resolve("out.png");

        assertThrows(StoreIOException.class,
                () -> store(target).save(new BufferedImage(4, 4, BufferedImage.TYPE_INT_ARGB)));
        assertFalse(Files.exists(target.getParent()));
    }

    @Test
    void shouldReportMissingFileAsNotFound() {
        StoreIOException error = assertThrows(StoreIOException.class,
                () -> store(tempDir.resolve("nope.jpg")).open());

        assertTrue(error.isNotFound());
    }

    @Test
    void shouldDeleteFile() {
        Path target = tempDir.resolve("gone.gif");
        store(target).save(new BufferedImage(3, 3, BufferedImage.TYPE_INT_ARGB));

        store(target).delete();

        assertFalse(Files.exists(target));
    }
}
