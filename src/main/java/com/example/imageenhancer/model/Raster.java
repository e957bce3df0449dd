package com.example.imageenhancer.model;

import com.example.imageenhancer.exception.InvalidImageInputException;

import java.util.Arrays;

/**
 * Decoded image held as interleaved, row-major samples normalized to {@code [0.0, 1.0]}. The sample
 * for row {@code y}, column {@code x} and channel {@code c} lives at
 * {@code (y * width + x) * channels + c}. A four channel raster carries alpha in its last channel.
 * <p>
 * Instances are immutable: factories copy the caller's array, accessors never expose the backing
 * store.
 */
public final class Raster {

    public static final int MAX_SAMPLE_VALUE = 255;

    private final int height;
    private final int width;
    private final int channels;
    private final float[] samples;

    private Raster(int height, int width, int channels, float[] samples) {
        this.height = height;
        this.width = width;
        this.channels = channels;
        this.samples = samples;
    }

    /**
     * Creates a raster from normalized samples. The array is copied and every sample must be a
     * finite value within {@code [0.0, 1.0]}.
     */
    public static Raster of(int height, int width, int channels, float[] samples) {
        validateLayout(height, width, channels, samples);
        for (int i = 0; i < samples.length; i++) {
            float value = samples[i];
            if (!(value >= 0f && value <= 1f)) {
                throw new InvalidImageInputException(
                        "Sample " + i + " is outside the normalized range [0, 1]: " + value);
            }
        }
        return new Raster(height, width, channels, samples.clone());
    }

    /**
     * Creates a raster from 8-bit sample values in {@code [0, 255]}.
     */
    public static Raster fromUnsigned8(int height, int width, int channels, int... values) {
        if (values == null) {
            throw new InvalidImageInputException("Sample array is required");
        }
        float[] normalized = new float[values.length];
        for (int i = 0; i < values.length; i++) {
            int value = values[i];
            if (value < 0 || value > MAX_SAMPLE_VALUE) {
                throw new InvalidImageInputException("Sample " + i + " is not an unsigned 8-bit value: " + value);
            }
            normalized[i] = value / (float) MAX_SAMPLE_VALUE;
        }
        validateLayout(height, width, channels, normalized);
        return new Raster(height, width, channels, normalized);
    }

    /**
     * Creates a raster whose samples all equal {@code value}.
     */
    public static Raster filled(int height, int width, int channels, float value) {
        float[] samples = new float[checkedSampleCount(height, width, channels)];
        Arrays.fill(samples, value);
        return of(height, width, channels, samples);
    }

    /**
     * Wraps an array produced by a pipeline stage without copying it. Stages clamp their output, so
     * only the layout is checked here; the caller must not touch the array afterwards.
     */
    public static Raster wrap(int height, int width, int channels, float[] samples) {
        validateLayout(height, width, channels, samples);
        return new Raster(height, width, channels, samples);
    }

    /**
     * Checks that the requested layout is one the pipeline supports and returns its sample count.
     */
    public static int checkedSampleCount(int height, int width, int channels) {
        if (height <= 0 || width <= 0) {
            throw new InvalidImageInputException("Raster must have a positive area, got " + width + "x" + height);
        }
        if (channels != 1 && channels != 3 && channels != 4) {
            throw new InvalidImageInputException("Unsupported channel count " + channels + ", expected 1, 3 or 4");
        }
        long count = (long) height * width * channels;
        if (count > Integer.MAX_VALUE - 8) {
            throw new InvalidImageInputException("Raster " + width + "x" + height + "x" + channels + " is too large");
        }
        return (int) count;
    }

    private static void validateLayout(int height, int width, int channels, float[] samples) {
        int expected = checkedSampleCount(height, width, channels);
        if (samples == null) {
            throw new InvalidImageInputException("Sample array is required");
        }
        if (samples.length != expected) {
            throw new InvalidImageInputException(
                    "Expected " + expected + " samples for " + width + "x" + height + "x" + channels
                            + " but got " + samples.length);
        }
    }

    public int height() {
        return height;
    }

    public int width() {
        return width;
    }

    public int channels() {
        return channels;
    }

    public boolean hasAlpha() {
        return channels == 4;
    }

    /**
     * Number of leading channels that carry color or intensity; alpha is excluded.
     */
    public int colorChannels() {
        return hasAlpha() ? 3 : channels;
    }

    public int pixelCount() {
        return height * width;
    }

    public int sampleCount() {
        return samples.length;
    }

    public float sample(int y, int x, int channel) {
        return samples[(y * width + x) * channels + channel];
    }

    public float sampleAt(int index) {
        return samples[index];
    }

    public int unsigned8(int y, int x, int channel) {
        return Math.round(sample(y, x, channel) * MAX_SAMPLE_VALUE);
    }

    /**
     * Returns a copy of the interleaved samples.
     */
    public float[] samples() {
        return samples.clone();
    }

    /**
     * Allocates a zeroed sample array with this raster's layout.
     */
    public float[] newSampleArray() {
        return new float[samples.length];
    }

    public boolean sameLayoutAs(Raster other) {
        return other != null && height == other.height && width == other.width && channels == other.channels;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Raster other)) {
            return false;
        }
        return sameLayoutAs(other) && Arrays.equals(samples, other.samples);
    }

    @Override
    public int hashCode() {
        int result = Integer.hashCode(height);
        result = 31 * result + Integer.hashCode(width);
        result = 31 * result + Integer.hashCode(channels);
        result = 31 * result + Arrays.hashCode(samples);
        return result;
    }

    @Override
    public String toString() {
        return "Raster[" + width + "x" + height + "x" + channels + "]";
    }
}
