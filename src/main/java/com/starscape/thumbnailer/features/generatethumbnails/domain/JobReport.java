package com.starscape.thumbnailer.features.generatethumbnails.domain;

import java.util.List;
import java.util.Optional;

/**
 * Everything a caller gets back from a job: one result per option, in option order.
 */
public record JobReport(List<ThumbnailResult> results, boolean sourceDeleted) {

    public JobReport {
        results = List.copyOf(results);
    }

    /**
     * A job counts as failed as soon as one option failed; the successes stay in {@link #results()}.
     */
    public boolean failed() {
        return results.stream().anyMatch(result -> !result.succeeded());
    }

    public Optional<RuntimeException> firstError() {
        return results.stream()
                .filter(result -> !result.succeeded())
                .map(ThumbnailResult::error)
                .findFirst();
    }

    public JobReport withSourceDeleted() {
        return new JobReport(results, true);
    }
}
