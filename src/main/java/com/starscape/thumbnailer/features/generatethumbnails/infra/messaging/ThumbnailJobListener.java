package com.starscape.thumbnailer.features.generatethumbnails.infra.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.thumbnailer.features.generatethumbnails.api.dto.ThumbnailJobRequest;
import com.starscape.thumbnailer.features.generatethumbnails.app.ThumbnailGenerationService;
import com.starscape.thumbnailer.features.generatethumbnails.domain.JobReport;
import com.starscape.thumbnailer.features.generatethumbnails.domain.ThumbnailJob;
import io.awspring.cloud.sqs.annotation.SqsListener;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Consumes thumbnail jobs from SQS. The message body is the same JSON accepted by {@code POST /thumbs}.
 *
 * <p>Messages that cannot be parsed or fail validation are logged and acknowledged, since
 * redelivery would never fix them. A job-level error or a single failed option is rethrown
 * so the message stays on the queue and is redelivered after its visibility timeout.
 *
 * Only enabled when spring.cloud.aws.sqs.enabled=true
 */
@Component
@ConditionalOnProperty(name = "spring.cloud.aws.sqs.enabled", havingValue = "true", matchIfMissing = false)
public class ThumbnailJobListener {

    private static final Logger log = LoggerFactory.getLogger(ThumbnailJobListener.class);

    private final ThumbnailGenerationService generationService;
    private final ObjectMapper objectMapper;
    private final Validator validator;

    public ThumbnailJobListener(ThumbnailGenerationService generationService, ObjectMapper objectMapper, Validator validator) {
        this.generationService = generationService;
        this.objectMapper = objectMapper;
        this.validator = validator;
    }

    @SqsListener("${aws.sqs.queue-url}")
    public void handleJob(String message) {
        log.info("Received thumbnail job message: {}", message);

        ThumbnailJob job = parse(message);
        if (job == null) {
            return;
        }

        JobReport report = generationService.process(job);
        if (report.failed()) {
            throw new RuntimeException("Thumbnail job for " + job.sourceImage() + " had failures",
                    report.firstError().orElse(null));
        }
        log.info("Thumbnail job for {} completed with {} thumbnail(s)", job.sourceImage(), report.results().size());
    }

    /**
     * @return the job, or {@code null} when the message is dropped
     */
    private ThumbnailJob parse(String message) {
        ThumbnailJobRequest request;
        try {
            request = objectMapper.readValue(message, ThumbnailJobRequest.class);
        } catch (JsonProcessingException e) {
            log.error("Dropping thumbnail job message that is not valid JSON: {}", e.getOriginalMessage());
            return null;
        }

        Set<ConstraintViolation<ThumbnailJobRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .map(violation -> violation.getPropertyPath() + " " + violation.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
            log.error("Dropping invalid thumbnail job message: {}", details);
            return null;
        }

        try {
            return request.toJob();
        } catch (IllegalArgumentException e) {
            log.error("Dropping invalid thumbnail job message: {}", e.getMessage());
            return null;
        }
    }
}
