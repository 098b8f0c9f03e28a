package com.starscape.thumbnailer.features.generatethumbnails.infra.store;

import com.starscape.thumbnailer.common.config.ThumbnailerProperties;
import com.starscape.thumbnailer.common.exception.ErrorKind;
import com.starscape.thumbnailer.common.exception.UnsupportedSchemeException;
import com.starscape.thumbnailer.features.generatethumbnails.infra.codec.ImageCodec;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.s3.S3Client;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;

class ImageStoreResolverTest {

    private final ThumbnailerProperties properties = new ThumbnailerProperties();
    private final ImageStoreResolver resolver =
            new ImageStoreResolver(new ImageCodec(properties), mock(S3Client.class), properties);

    @Test
    void shouldResolveFileAndS3Schemes() {
        assertInstanceOf(FileImageStore.class, resolver.resolve(URI.create("file:///tmp/cat.jpg")));
        assertInstanceOf(S3ImageStore.class, resolver.resolve(URI.create("s3://bucket/cat.jpg")));
        assertInstanceOf(S3ImageStore.class, resolver.resolve(URI.create("S3://bucket/cat.jpg")));
    }

    @Test
    void shouldRejectUnknownScheme() {
        UnsupportedSchemeException error = assertThrows(UnsupportedSchemeException.class,
                () -> resolver.resolve(URI.create("ftp://host/cat.jpg")));

        assertEquals(ErrorKind.SCHEME, error.getKind());
    }

    @Test
    void shouldRejectLocationWithoutScheme() {
        assertThrows(UnsupportedSchemeException.class, () -> resolver.resolve(URI.create("/tmp/cat.jpg")));
    }
}
