package com.starscape.thumbnailer.features.generatethumbnails.app;

import com.starscape.thumbnailer.features.generatethumbnails.domain.ThumbnailResult;

/**
 * Receives each option's result as soon as it is known, in completion order.
 * Called from worker threads.
 */
@FunctionalInterface
public interface ThumbnailResultListener {

    ThumbnailResultListener NONE = result -> { };

    void onResult(ThumbnailResult result);
}
