package com.example.imageenhancer.service.stage;

import com.example.imageenhancer.exception.ResourceExhaustedException;
import com.example.imageenhancer.model.InterpolationMethod;
import com.example.imageenhancer.model.ParameterSet;
import com.example.imageenhancer.model.Raster;
import com.example.imageenhancer.util.ResamplingKernel;
import com.example.imageenhancer.util.SampleMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resamples a raster to {@code round(height * scale) x round(width * scale)}. Filtered methods run
 * as two separable passes over pixel centers; coordinates outside the source are clamped to the
 * border and results are clamped to the sample range.
 */
public class UpscalingStage implements EnhancementStage {

    private static final Logger log = LoggerFactory.getLogger(UpscalingStage.class);

    public static final long DEFAULT_MAX_OUTPUT_SAMPLES = 1L << 28;

    private final long maxOutputSamples;

    public UpscalingStage() {
        this(DEFAULT_MAX_OUTPUT_SAMPLES);
    }

    public UpscalingStage(long maxOutputSamples) {
        if (maxOutputSamples <= 0) {
            throw new IllegalArgumentException("Output sample limit must be positive, got " + maxOutputSamples);
        }
        this.maxOutputSamples = Math.min(maxOutputSamples, Integer.MAX_VALUE - 8L);
    }

    @Override
    public String name() {
        return "upscale";
    }

    @Override
    public Raster apply(Raster input, ParameterSet parameters) {
        return upscale(input, parameters.scaleFactor(), parameters.interpolationMethod());
    }

    public Raster upscale(Raster input, double scaleFactor, InterpolationMethod method) {
        if (scaleFactor == 1.0) {
            return input;
        }
        int targetHeight = targetDimension(input.height(), scaleFactor);
        int targetWidth = targetDimension(input.width(), scaleFactor);
        ensureCapacity(targetHeight, targetWidth, input.channels());

        Raster output;
        try {
            output = method == InterpolationMethod.NEAREST
                    ? nearest(input, targetHeight, targetWidth)
                    : filtered(input, targetHeight, targetWidth, ResamplingKernel.forMethod(method));
        } catch (OutOfMemoryError e) {
            throw new ResourceExhaustedException(String.format(
                    "Not enough memory to upscale %dx%d to %dx%d; retry with a smaller scale factor",
                    input.width(), input.height(), targetWidth, targetHeight), e);
        }
        log.debug("Upscaled image from {}x{} to {}x{} using {}",
                input.width(), input.height(), targetWidth, targetHeight, method);
        return output;
    }

    /**
     * Fails fast when upscaling {@code input} by {@code scaleFactor} would exceed the sample limit.
     */
    public void ensureCapacity(Raster input, double scaleFactor) {
        if (scaleFactor == 1.0) {
            return;
        }
        ensureCapacity(targetDimension(input.height(), scaleFactor),
                targetDimension(input.width(), scaleFactor), input.channels());
    }

    public static int targetDimension(int size, double scaleFactor) {
        if (!(scaleFactor > 0.0)) {
            throw new IllegalArgumentException("Scale factor must be positive, got " + scaleFactor);
        }
        long target = Math.round(size * scaleFactor);
        if (target > Integer.MAX_VALUE) {
            throw new ResourceExhaustedException("Scaled dimension " + target + " exceeds the addressable range");
        }
        return (int) Math.max(1L, target);
    }

    private void ensureCapacity(int height, int width, int channels) {
        long samples = (long) height * width * channels;
        if (samples > maxOutputSamples) {
            throw new ResourceExhaustedException(String.format(
                    "Upscaled raster %dx%dx%d needs %d samples, limit is %d; retry with a smaller scale factor or input",
                    width, height, channels, samples, maxOutputSamples));
        }
    }

    private Raster nearest(Raster input, int targetHeight, int targetWidth) {
        int channels = input.channels();
        int[] sourceX = nearestIndices(input.width(), targetWidth);
        int[] sourceY = nearestIndices(input.height(), targetHeight);
        float[] output = new float[targetHeight * targetWidth * channels];
        int index = 0;
        for (int y = 0; y < targetHeight; y++) {
            for (int x = 0; x < targetWidth; x++) {
                for (int c = 0; c < channels; c++) {
                    output[index++] = input.sample(sourceY[y], sourceX[x], c);
                }
            }
        }
        return Raster.wrap(targetHeight, targetWidth, channels, output);
    }

    private static int[] nearestIndices(int sourceSize, int targetSize) {
        double ratio = sourceSize / (double) targetSize;
        int[] indices = new int[targetSize];
        for (int i = 0; i < targetSize; i++) {
            indices[i] = SampleMath.clamp((int) Math.floor((i + 0.5) * ratio), 0, sourceSize - 1);
        }
        return indices;
    }

    private Raster filtered(Raster input, int targetHeight, int targetWidth, ResamplingKernel kernel) {
        int sourceHeight = input.height();
        int channels = input.channels();
        Taps columns = Taps.compute(input.width(), targetWidth, kernel);
        Taps rows = Taps.compute(sourceHeight, targetHeight, kernel);

        double[] horizontal = new double[sourceHeight * targetWidth * channels];
        for (int y = 0; y < sourceHeight; y++) {
            for (int x = 0; x < targetWidth; x++) {
                int base = (y * targetWidth + x) * channels;
                for (int t = 0; t < columns.count; t++) {
                    int sx = columns.indices[x][t];
                    double weight = columns.weights[x][t];
                    for (int c = 0; c < channels; c++) {
                        horizontal[base + c] += weight * input.sample(y, sx, c);
                    }
                }
            }
        }

        float[] output = new float[targetHeight * targetWidth * channels];
        for (int y = 0; y < targetHeight; y++) {
            for (int x = 0; x < targetWidth; x++) {
                int base = (y * targetWidth + x) * channels;
                for (int c = 0; c < channels; c++) {
                    double acc = 0.0;
                    for (int t = 0; t < rows.count; t++) {
                        acc += rows.weights[y][t] * horizontal[(rows.indices[y][t] * targetWidth + x) * channels + c];
                    }
                    output[base + c] = SampleMath.clampUnit(acc);
                }
            }
        }
        return Raster.wrap(targetHeight, targetWidth, channels, output);
    }

    /**
     * Source indices and normalized weights contributing to every target coordinate along one axis.
     */
    private static final class Taps {

        private final int count;
        private final int[][] indices;
        private final double[][] weights;

        private Taps(int count, int[][] indices, double[][] weights) {
            this.count = count;
            this.indices = indices;
            this.weights = weights;
        }

        private static Taps compute(int sourceSize, int targetSize, ResamplingKernel kernel) {
            double ratio = sourceSize / (double) targetSize;
            double radius = kernel.radius();
            int count = (int) (2 * radius);
            int[][] indices = new int[targetSize][count];
            double[][] weights = new double[targetSize][count];
            for (int i = 0; i < targetSize; i++) {
                double center = (i + 0.5) * ratio - 0.5;
                int first = (int) Math.floor(center - radius) + 1;
                double sum = 0.0;
                for (int t = 0; t < count; t++) {
                    int position = first + t;
                    double weight = kernel.weight(center - position);
                    indices[i][t] = SampleMath.clamp(position, 0, sourceSize - 1);
                    weights[i][t] = weight;
                    sum += weight;
                }
                if (sum != 0.0) {
                    for (int t = 0; t < count; t++) {
                        weights[i][t] /= sum;
                    }
                }
            }
            return new Taps(count, indices, weights);
        }
    }
}
