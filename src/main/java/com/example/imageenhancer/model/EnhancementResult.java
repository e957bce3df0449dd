package com.example.imageenhancer.model;

import java.util.Objects;

/**
 * Output of one pipeline run.
 *
 * @param image         the enhanced raster
 * @param before        statistics of the input raster
 * @param after         statistics of {@code image}
 * @param elapsedMillis wall-clock duration of the run
 */
public record EnhancementResult(Raster image, StatisticsRecord before, StatisticsRecord after, long elapsedMillis) {

    public EnhancementResult {
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(before, "before");
        Objects.requireNonNull(after, "after");
    }

    public StatisticsComparison comparison() {
        return new StatisticsComparison(before, after);
    }
}
