package com.starscape.thumbnailer.features.generatethumbnails.app;

import com.starscape.thumbnailer.common.config.PassthroughNaming;
import com.starscape.thumbnailer.common.config.ThumbnailerProperties;
import com.starscape.thumbnailer.common.exception.InvalidLocationException;
import com.starscape.thumbnailer.features.generatethumbnails.domain.CropRectangle;
import com.starscape.thumbnailer.features.generatethumbnails.domain.ImageSize;
import com.starscape.thumbnailer.features.generatethumbnails.domain.ThumbnailJob;
import com.starscape.thumbnailer.features.generatethumbnails.domain.ThumbnailOption;
import com.starscape.thumbnailer.features.generatethumbnails.infra.codec.ImageFormat;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Decides where the thumbnail of an option is written.
 *
 * <p>An explicit destination is used as is. Otherwise the file goes to the job's destination
 * folder, named after the source file (without its extension):
 * <ul>
 *   <li>crop: {@code {base}_c{minX}-{minY}-{maxX}-{maxY}_s{width}x{height}{ext}}</li>
 *   <li>no crop, no resize: see {@link PassthroughNaming}</li>
 *   <li>otherwise: {@code {base}_s{width}x{height}{ext}}</li>
 * </ul>
 * {@code {ext}} is the source extension in lower case and the sizes are the resolved ones.
 */
@Component
public class ThumbnailNamingPolicy {

    private final PassthroughNaming passthroughNaming;

    public ThumbnailNamingPolicy(ThumbnailerProperties properties) {
        this.passthroughNaming = properties.getPassthroughNaming();
    }

    /**
     * @param size the resolved output size of the option
     * @throws InvalidLocationException when the destination or the source location is malformed
     */
    public URI resolveOutputUri(ThumbnailJob job, ThumbnailOption option, ImageSize size) {
        if (option.hasExplicitDestination()) {
            return ThumbnailJob.parseLocation(option.destination());
        }
        URI folder = job.destinationFolderUri();
        String fileName = fileName(sourceFileName(job), option, size);
        return inFolder(folder, fileName);
    }

    String fileName(String sourceFileName, ThumbnailOption option, ImageSize size) {
        String ext = ImageFormat.extensionOf(sourceFileName);
        String base = sourceFileName.substring(0, sourceFileName.length() - ext.length());

        if (option.hasCrop()) {
            CropRectangle crop = option.crop();
            return String.format("%s_c%d-%d-%d-%d_s%dx%d%s", base,
                    crop.minX(), crop.minY(), crop.maxX(), crop.maxY(), size.width(), size.height(), ext);
        }
        if (option.isPassthrough()) {
            return switch (passthroughNaming) {
                case BASE_NAME -> base;
                case KEEP_EXTENSION -> base + ext;
                case SIZED -> sized(base, size, ext);
            };
        }
        return sized(base, size, ext);
    }

    private static String sized(String base, ImageSize size, String ext) {
        return String.format("%s_s%dx%d%s", base, size.width(), size.height(), ext);
    }

    private static String sourceFileName(ThumbnailJob job) {
        URI source = job.sourceUri();
        String path = source.getPath();
        if (path == null || path.isEmpty() || path.endsWith("/")) {
            throw new InvalidLocationException("Source has no file name: " + job.sourceImage());
        }
        return path.substring(path.lastIndexOf('/') + 1);
    }

    private static URI inFolder(URI folder, String fileName) {
        String directory = folder.getPath() == null ? "" : folder.getPath();
        while (directory.endsWith("/")) {
            directory = directory.substring(0, directory.length() - 1);
        }
        boolean hierarchical = folder.getScheme() != null || folder.getAuthority() != null;
        String path = directory.isEmpty() && !hierarchical ? fileName : directory + "/" + fileName;
        // An empty authority keeps the "file:///dir" form of local folders
        String authority = folder.getAuthority();
        if (authority == null && folder.getScheme() != null) {
            authority = "";
        }
        try {
            return new URI(folder.getScheme(), authority, path, null, null);
        } catch (URISyntaxException e) {
            throw new InvalidLocationException(folder + "/" + fileName, e);
        }
    }
}
