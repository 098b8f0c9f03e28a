package com.starscape.thumbnailer.features.generatethumbnails.app;

import com.starscape.thumbnailer.common.exception.ThumbnailerException;
import com.starscape.thumbnailer.features.generatethumbnails.domain.ImageSize;
import com.starscape.thumbnailer.features.generatethumbnails.domain.JobReport;
import com.starscape.thumbnailer.features.generatethumbnails.domain.JobState;
import com.starscape.thumbnailer.features.generatethumbnails.domain.ThumbnailJob;
import com.starscape.thumbnailer.features.generatethumbnails.domain.ThumbnailOption;
import com.starscape.thumbnailer.features.generatethumbnails.domain.ThumbnailResult;
import com.starscape.thumbnailer.features.generatethumbnails.infra.store.ImageStore;
import com.starscape.thumbnailer.features.generatethumbnails.infra.store.ImageStoreResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Generates every thumbnail of a job from one decoded source image.
 *
 * <p>The source is opened and decoded once and converted to ARGB. When the job has several
 * options, the options that resize the uncropped source share one intermediate image, resized
 * once to the largest of their sizes; cropped options always start from the full-resolution
 * source. Each option is then cropped, resized, named and saved on the thumbnail executor.
 *
 * <p>A failure to open the source fails the whole job. Any later failure only fails its own
 * option: every option yields exactly one {@link ThumbnailResult} and siblings keep running.
 * Nothing is retried.
 */
@Service
public class ThumbnailGenerationService {

    private static final Logger log = LoggerFactory.getLogger(ThumbnailGenerationService.class);

    private final ImageStoreResolver storeResolver;
    private final ThumbnailNamingPolicy namingPolicy;
    private final ImageTransformer transformer;
    private final Executor executor;

    public ThumbnailGenerationService(
            ImageStoreResolver storeResolver,
            ThumbnailNamingPolicy namingPolicy,
            ImageTransformer transformer,
            @Qualifier("thumbnailTaskExecutor") Executor executor) {
        this.storeResolver = storeResolver;
        this.namingPolicy = namingPolicy;
        this.transformer = transformer;
        this.executor = executor;
    }

    /**
     * Generate all thumbnails, then delete the source if the job asks for it and no option failed.
     * Thumbnails already written by successful options are kept when another option fails.
     *
     * @throws ThumbnailerException when the source cannot be opened, or the requested delete fails
     */
    public JobReport process(ThumbnailJob job) {
        JobReport report = generate(job);

        if (report.failed()) {
            log.warn("At least one thumbnail failed for {}: {}", job.sourceImage(),
                    report.firstError().map(Throwable::getMessage).orElse("unknown error"));
            if (job.deleteSourceOnSuccess()) {
                log.info("Keeping source {} because a thumbnail failed", job.sourceImage());
            }
            return report;
        }

        if (job.deleteSourceOnSuccess()) {
            deleteSource(job);
            return report.withSourceDeleted();
        }
        return report;
    }

    public JobReport generate(ThumbnailJob job) {
        return generate(job, ThumbnailResultListener.NONE);
    }

    /**
     * Generate all thumbnails of a job, blocking until every option has reported.
     *
     * @param listener notified once per option as results complete
     * @return the results in option order
     * @throws ThumbnailerException when the source cannot be opened; no option runs in that case
     */
    public JobReport generate(ThumbnailJob job, ThumbnailResultListener listener) {
        String jobId = UUID.randomUUID().toString().substring(0, 8);
        long start = System.nanoTime();

        enter(jobId, JobState.OPENING, job.sourceImage());
        BufferedImage decoded;
        try {
            URI sourceUri = job.sourceUri();
            decoded = storeResolver.resolve(sourceUri).open();
        } catch (ThumbnailerException e) {
            enter(jobId, JobState.FAILED, job.sourceImage());
            log.error("Failed to open source image {}: {}", job.sourceImage(), e.getMessage());
            throw e;
        }

        enter(jobId, JobState.PREPARING, job.sourceImage());
        BufferedImage source = transformer.toCanonical(decoded);
        ImageSize sourceSize = ImageSize.of(source);
        log.debug("Job {} source bounds {}", jobId, sourceSize);
        BufferedImage shared = sharedImage(jobId, job, source, sourceSize).orElse(null);

        enter(jobId, JobState.DISPATCHING, job.sourceImage());
        List<CompletableFuture<ThumbnailResult>> pending = new ArrayList<>(job.options().size());
        for (ThumbnailOption option : job.options()) {
            BufferedImage input = shared == null || option.hasCrop() || option.isPassthrough() ? source : shared;
            pending.add(dispatch(job, option, input, sourceSize, listener));
        }

        enter(jobId, JobState.COLLECTING, job.sourceImage());
        List<ThumbnailResult> results = pending.stream()
                .map(CompletableFuture::join)
                .toList();

        enter(jobId, JobState.DONE, job.sourceImage());
        long failures = results.stream().filter(result -> !result.succeeded()).count();
        log.info("Job {} generated {} thumbnail(s) for {} in {} ms ({} failed)", jobId, results.size(),
                job.sourceImage(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start), failures);
        return new JobReport(results, false);
    }

    /**
     * Delete the job's source image. Only the local filesystem supports this.
     *
     * @throws com.starscape.thumbnailer.common.exception.DeleteNotSupportedException for other stores
     */
    public void deleteSource(ThumbnailJob job) {
        log.info("Deleting source image {}", job.sourceImage());
        ImageStore store = storeResolver.resolve(job.sourceUri());
        store.delete();
    }

    private Optional<BufferedImage> sharedImage(String jobId, ThumbnailJob job, BufferedImage source, ImageSize sourceSize) {
        if (job.options().size() <= 1) {
            return Optional.empty();
        }
        try {
            Optional<ImageSize> box = ThumbnailGeometry.sharedBox(job.options(), sourceSize);
            if (box.isEmpty() || box.get().equals(sourceSize)) {
                return Optional.empty();
            }
            log.debug("Job {} shared resize {} -> {}", jobId, sourceSize, box.get());
            return Optional.of(transformer.resize(source, box.get()));
        } catch (RuntimeException | OutOfMemoryError e) {
            // Options that cannot be sized or allocated fail on their own when dispatched
            log.warn("Job {} shared resize failed, resizing each option from the source: {}", jobId, e.toString());
            return Optional.empty();
        }
    }

    private CompletableFuture<ThumbnailResult> dispatch(
            ThumbnailJob job,
            ThumbnailOption option,
            BufferedImage input,
            ImageSize sourceSize,
            ThumbnailResultListener listener) {
        CompletableFuture<ThumbnailResult> future;
        try {
            future = CompletableFuture.supplyAsync(() -> generateThumbnail(job, option, input, sourceSize), executor);
        } catch (RejectedExecutionException e) {
            log.warn("Thumbnail executor rejected option {} of {}", option, job.sourceImage());
            future = CompletableFuture.completedFuture(ThumbnailResult.failure(option, e));
        }
        return future
                .handle((result, error) -> result != null ? result : ThumbnailResult.failure(option, unwrap(error)))
                .thenApply(result -> notify(listener, result));
    }

    ThumbnailResult generateThumbnail(ThumbnailJob job, ThumbnailOption option, BufferedImage input, ImageSize sourceSize) {
        long start = System.nanoTime();
        URI target = null;
        try {
            BufferedImage region = input;
            ImageSize size;
            if (option.hasCrop()) {
                region = transformer.crop(input, option.crop());
                size = ThumbnailGeometry.resolve(option, ImageSize.of(region));
            } else {
                size = ThumbnailGeometry.resolve(option, sourceSize);
            }
            BufferedImage thumbnail = transformer.resize(region, size);

            target = namingPolicy.resolveOutputUri(job, option, size);
            long generated = System.nanoTime();
            log.debug("thumb {} generated in {} ms", target, TimeUnit.NANOSECONDS.toMillis(generated - start));

            storeResolver.resolve(target).save(thumbnail);
            log.debug("thumb {} saved in {} ms", target, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - generated));
            return ThumbnailResult.success(option, target);
        } catch (RuntimeException e) {
            log.warn("Failed to generate thumbnail {} of {}: {}",
                    target != null ? target : option, job.sourceImage(), e.getMessage());
            return ThumbnailResult.failure(option, e);
        } catch (OutOfMemoryError e) {
            log.warn("Not enough memory for thumbnail {} of {}", option.width() + "x" + option.height(), job.sourceImage());
            return ThumbnailResult.failure(option,
                    new IllegalStateException("Not enough memory to generate a " + option.width() + "x" + option.height() + " thumbnail", e));
        }
    }

    private ThumbnailResult notify(ThumbnailResultListener listener, ThumbnailResult result) {
        try {
            listener.onResult(result);
        } catch (RuntimeException e) {
            log.warn("Thumbnail result listener failed for {}", result.thumbnail(), e);
        }
        return result;
    }

    private static RuntimeException unwrap(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        return new IllegalStateException("Thumbnail task failed: " + cause, cause);
    }

    private static void enter(String jobId, JobState state, String source) {
        log.debug("Job {} {} ({})", jobId, state, source);
    }
}
