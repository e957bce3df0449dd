package com.example.imageenhancer.model;

import java.util.List;
import java.util.Objects;

/**
 * Descriptive snapshot of one raster. Intensity figures are expressed in 8-bit sample units
 * ({@code 0..255}) so that records of differently encoded images stay comparable.
 *
 * @param width                     raster width in pixels
 * @param height                    raster height in pixels
 * @param channels                  channel count, alpha included
 * @param channelMeans              arithmetic mean of every channel
 * @param channelStandardDeviations population standard deviation of every channel
 * @param minSample                 smallest color sample, alpha excluded
 * @param maxSample                 largest color sample, alpha excluded
 * @param meanBrightness            mean over every color sample of the raster
 * @param brightnessStandardDeviation standard deviation over every color sample of the raster
 * @param sharpness                 variance of the Laplacian of luma
 * @param entropy                   Shannon entropy of the 256-bin luma histogram, in bits
 */
public record StatisticsRecord(
        int width,
        int height,
        int channels,
        List<Double> channelMeans,
        List<Double> channelStandardDeviations,
        double minSample,
        double maxSample,
        double meanBrightness,
        double brightnessStandardDeviation,
        double sharpness,
        double entropy) {

    private static final double BYTES_PER_MEGABYTE = 1024.0 * 1024.0;

    public StatisticsRecord {
        channelMeans = List.copyOf(Objects.requireNonNull(channelMeans, "channelMeans"));
        channelStandardDeviations = List.copyOf(
                Objects.requireNonNull(channelStandardDeviations, "channelStandardDeviations"));
        if (channelMeans.size() != channels || channelStandardDeviations.size() != channels) {
            throw new IllegalArgumentException("Per-channel statistics must cover " + channels + " channels");
        }
    }

    public long pixelCount() {
        return (long) width * height;
    }

    /**
     * Size of the uncompressed 8-bit sample buffer in megabytes.
     */
    public double sizeMegabytes() {
        return pixelCount() * channels / BYTES_PER_MEGABYTE;
    }
}
