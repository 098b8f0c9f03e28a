package com.starscape.thumbnailer.features.generatethumbnails.infra.store;

import com.starscape.thumbnailer.common.exception.InvalidLocationException;
import com.starscape.thumbnailer.common.exception.StoreIOException;
import com.starscape.thumbnailer.features.generatethumbnails.infra.codec.ImageCodec;
import com.starscape.thumbnailer.features.generatethumbnails.infra.codec.ImageFormat;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.ObjectCannedACL;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.net.URI;

/**
 * Image store over S3: the URI host is the bucket, the path the object key.
 * SDK failures surface as {@link StoreIOException} and are not retried here.
 */
public class S3ImageStore implements ImageStore {

    private final URI location;
    private final String bucket;
    private final String key;
    private final S3Client s3Client;
    private final ImageCodec codec;
    private final boolean publicRead;

    public S3ImageStore(URI location, S3Client s3Client, ImageCodec codec, boolean publicRead) {
        this.location = location;
        this.bucket = location.getHost();
        this.key = objectKey(location);
        if (bucket == null || bucket.isBlank()) {
            throw new InvalidLocationException("S3 URI has no bucket: " + location);
        }
        if (key.isEmpty()) {
            throw new InvalidLocationException("S3 URI has no object key: " + location);
        }
        this.s3Client = s3Client;
        this.codec = codec;
        this.publicRead = publicRead;
    }

    @Override
    public URI location() {
        return location;
    }

    public String getBucket() {
        return bucket;
    }

    public String getKey() {
        return key;
    }

    @Override
    public BufferedImage open() {
        GetObjectRequest getRequest = GetObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();

        try (ResponseInputStream<GetObjectResponse> response = s3Client.getObject(getRequest)) {
            return codec.decode(response, ImageFormat.extensionOf(key));
        } catch (NoSuchKeyException e) {
            throw new StoreIOException(location, "Image not found", e, true);
        } catch (SdkException | IOException e) {
            throw new StoreIOException(location, "Failed to read image", e);
        }
    }

    @Override
    public void save(BufferedImage image) {
        ImageFormat format = ImageFormat.forPath(key);
        byte[] data = codec.encode(image, format);

        PutObjectRequest.Builder putRequest = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(format.getMimeType())
                .contentLength((long) data.length);
        if (publicRead) {
            putRequest.acl(ObjectCannedACL.PUBLIC_READ);
        }

        try {
            s3Client.putObject(putRequest.build(), RequestBody.fromBytes(data));
        } catch (SdkException e) {
            throw new StoreIOException(location, "Failed to write image", e);
        }
    }

    private static String objectKey(URI location) {
        String path = location.getPath();
        if (path == null) {
            return "";
        }
        return path.startsWith("/") ? path.substring(1) : path;
    }
}
