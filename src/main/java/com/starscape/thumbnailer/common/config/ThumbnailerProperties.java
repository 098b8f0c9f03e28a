package com.starscape.thumbnailer.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for thumbnail generation.
 * Binds to app.thumbnailer.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.thumbnailer")
public class ThumbnailerProperties {

    private int maxConcurrency = 4;
    private int queueCapacity = 1000;
    private PassthroughNaming passthroughNaming = PassthroughNaming.BASE_NAME;
    private S3 s3 = new S3();
    private Codec codec = new Codec();
    private Http http = new Http();

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public PassthroughNaming getPassthroughNaming() {
        return passthroughNaming;
    }

    public void setPassthroughNaming(PassthroughNaming passthroughNaming) {
        this.passthroughNaming = passthroughNaming;
    }

    public S3 getS3() {
        return s3;
    }

    public void setS3(S3 s3) {
        this.s3 = s3;
    }

    public Codec getCodec() {
        return codec;
    }

    public void setCodec(Codec codec) {
        this.codec = codec;
    }

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public static class S3 {

        /**
         * Publish saved objects with the public-read canned ACL.
         */
        private boolean publicRead = true;

        public boolean isPublicRead() {
            return publicRead;
        }

        public void setPublicRead(boolean publicRead) {
            this.publicRead = publicRead;
        }
    }

    public static class Codec {

        /**
         * Class name of the ImageIO reader to prefer for JPEG sources, e.g. a native-backed plugin.
         * Falls back to the default reader when blank or not on the classpath.
         */
        private String jpegReaderClass;

        public String getJpegReaderClass() {
            return jpegReaderClass;
        }

        public void setJpegReaderClass(String jpegReaderClass) {
            this.jpegReaderClass = jpegReaderClass;
        }
    }

    public static class Http {

        private String sourceFolder;
        private String destinationFolder;

        public String getSourceFolder() {
            return sourceFolder;
        }

        public void setSourceFolder(String sourceFolder) {
            this.sourceFolder = sourceFolder;
        }

        public String getDestinationFolder() {
            return destinationFolder;
        }

        public void setDestinationFolder(String destinationFolder) {
            this.destinationFolder = destinationFolder;
        }
    }
}
