package com.starscape.thumbnailer.features.generatethumbnails.domain;

/**
 * Lifecycle of a job. {@code FAILED} is only reachable from {@code OPENING}.
 */
public enum JobState {
    OPENING,
    PREPARING,
    DISPATCHING,
    COLLECTING,
    DONE,
    FAILED
}
