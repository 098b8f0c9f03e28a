package com.starscape.thumbnailer.features.generatethumbnails.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.thumbnailer.common.config.ThumbnailerProperties;
import com.starscape.thumbnailer.features.generatethumbnails.api.dto.ThumbnailJobRequest;
import com.starscape.thumbnailer.features.generatethumbnails.api.dto.ThumbnailResultResponse;
import com.starscape.thumbnailer.features.generatethumbnails.app.ThumbnailGenerationService;
import com.starscape.thumbnailer.features.generatethumbnails.domain.JobReport;
import com.starscape.thumbnailer.features.generatethumbnails.domain.ThumbnailJob;
import com.starscape.thumbnailer.features.generatethumbnails.domain.ThumbnailOption;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Valid;
import jakarta.validation.Validator;
import org.apache.commons.codec.binary.Base64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.util.List;
import java.util.Set;

/**
 * HTTP entry points that run a thumbnail job synchronously and return one entry per option.
 * Responds 200 when every thumbnail was written and 500 when any failed; the body lists
 * every result either way.
 */
@RestController
public class ThumbnailController {

    private static final Logger log = LoggerFactory.getLogger(ThumbnailController.class);

    private final ThumbnailGenerationService generationService;
    private final ThumbnailerProperties properties;
    private final ObjectMapper objectMapper;
    private final Validator validator;

    public ThumbnailController(
            ThumbnailGenerationService generationService,
            ThumbnailerProperties properties,
            ObjectMapper objectMapper,
            Validator validator) {
        this.generationService = generationService;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.validator = validator;
    }

    @PostMapping("/thumbs")
    public ResponseEntity<List<ThumbnailResultResponse>> generate(@Valid @RequestBody ThumbnailJobRequest request) {
        return run(request.toJob());
    }

    /**
     * Same as {@link #generate(ThumbnailJobRequest)} with the JSON request URL-safe base64 encoded in the path.
     */
    @GetMapping("/thumbs/{encodedRequest}")
    public ResponseEntity<List<ThumbnailResultResponse>> generateEncoded(@PathVariable String encodedRequest) {
        ThumbnailJobRequest request = decodeRequest(encodedRequest);
        Set<ConstraintViolation<ThumbnailJobRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            throw new ConstraintViolationException(violations);
        }
        return run(request.toJob());
    }

    /**
     * One resized copy of a file from the configured source folder, e.g. {@code /thumb/50x50/my-picture.jpg}.
     */
    @GetMapping("/thumb/{width:\\d+}x{height:\\d+}/{filename:.+}")
    public ResponseEntity<List<ThumbnailResultResponse>> generateSingle(
            @PathVariable int width,
            @PathVariable int height,
            @PathVariable String filename) {
        ThumbnailerProperties.Http http = properties.getHttp();
        if (isBlank(http.getSourceFolder()) || isBlank(http.getDestinationFolder())) {
            throw new IllegalStateException("Single thumbnail endpoint needs app.thumbnailer.http.source-folder and destination-folder");
        }
        if (filename.contains("..") || filename.contains("/") || filename.contains("\\")) {
            throw new IllegalArgumentException("Invalid file name: " + filename);
        }

        String sourceFolder = http.getSourceFolder().endsWith("/") ? http.getSourceFolder() : http.getSourceFolder() + "/";
        ThumbnailJob job = new ThumbnailJob(
                sourceFolder + filename,
                http.getDestinationFolder(),
                false,
                List.of(ThumbnailOption.ofSize(width, height)));
        return run(job);
    }

    private ResponseEntity<List<ThumbnailResultResponse>> run(ThumbnailJob job) {
        log.info("Thumbnail request for {} with {} option(s)", job.sourceImage(), job.options().size());
        JobReport report = generationService.process(job);

        List<ThumbnailResultResponse> body = report.results().stream()
                .map(ThumbnailResultResponse::from)
                .toList();
        HttpStatus status = report.failed() ? HttpStatus.INTERNAL_SERVER_ERROR : HttpStatus.OK;
        return ResponseEntity.status(status).body(body);
    }

    private ThumbnailJobRequest decodeRequest(String encodedRequest) {
        if (!Base64.isBase64(encodedRequest)) {
            throw new IllegalArgumentException("Failed to decode the thumbnail request: not base64");
        }
        byte[] json = Base64.decodeBase64(encodedRequest);
        try {
            return objectMapper.readValue(json, ThumbnailJobRequest.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to decode the thumbnail request: " + e.getMessage(), e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
