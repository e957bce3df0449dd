package com.example.imageenhancer.model;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Pairs the statistics of an original raster with those of its enhanced counterpart and derives the
 * figures a presentation layer shows side by side.
 */
public record StatisticsComparison(StatisticsRecord before, StatisticsRecord after) {

    public StatisticsComparison {
        Objects.requireNonNull(before, "before");
        Objects.requireNonNull(after, "after");
    }

    public double resolutionIncrease() {
        return after.pixelCount() / (double) before.pixelCount();
    }

    public int widthDelta() {
        return after.width() - before.width();
    }

    public int heightDelta() {
        return after.height() - before.height();
    }

    public double sizeDeltaMegabytes() {
        return after.sizeMegabytes() - before.sizeMegabytes();
    }

    public double brightnessDelta() {
        return after.meanBrightness() - before.meanBrightness();
    }

    public double sharpnessDelta() {
        return after.sharpness() - before.sharpness();
    }

    /**
     * Metric by metric view of both records, formatted for display.
     */
    public List<Row> rows() {
        return List.of(
                new Row("Width", Integer.toString(before.width()), Integer.toString(after.width())),
                new Row("Height", Integer.toString(before.height()), Integer.toString(after.height())),
                new Row("Total Pixels", Long.toString(before.pixelCount()), Long.toString(after.pixelCount())),
                new Row("File Size (MB)", format("%.2f", before.sizeMegabytes()), format("%.2f", after.sizeMegabytes())),
                new Row("Mean Brightness", format("%.1f", before.meanBrightness()), format("%.1f", after.meanBrightness())),
                new Row("Brightness Std", format("%.1f", before.brightnessStandardDeviation()),
                        format("%.1f", after.brightnessStandardDeviation())),
                new Row("Sharpness", format("%.1f", before.sharpness()), format("%.1f", after.sharpness())),
                new Row("Entropy", format("%.2f", before.entropy()), format("%.2f", after.entropy())));
    }

    public String summary() {
        return format("%.1fx resolution increase with %d×%d final dimensions",
                resolutionIncrease(), after.width(), after.height());
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }

    public record Row(String metric, String original, String enhanced) {
    }
}
