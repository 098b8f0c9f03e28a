package com.starscape.thumbnailer.features.generatethumbnails.infra.store;

import com.starscape.thumbnailer.common.config.ThumbnailerProperties;
import com.starscape.thumbnailer.common.exception.UnsupportedSchemeException;
import com.starscape.thumbnailer.features.generatethumbnails.infra.codec.ImageCodec;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.s3.S3Client;

import java.net.URI;

/**
 * Binds a location to the image store for its scheme. A new store is created per call.
 */
@Component
public class ImageStoreResolver {

    private final ImageCodec codec;
    private final S3Client s3Client;
    private final boolean s3PublicRead;

    public ImageStoreResolver(ImageCodec codec, S3Client s3Client, ThumbnailerProperties properties) {
        this.codec = codec;
        this.s3Client = s3Client;
        this.s3PublicRead = properties.getS3().isPublicRead();
    }

    /**
     * @throws UnsupportedSchemeException when no store handles the location's scheme
     */
    public ImageStore resolve(URI location) {
        StoreScheme scheme = StoreScheme.of(location)
                .orElseThrow(() -> new UnsupportedSchemeException(location));

        return switch (scheme) {
            case FILE -> new FileImageStore(location, codec);
            case S3 -> new S3ImageStore(location, s3Client, codec, s3PublicRead);
        };
    }
}
