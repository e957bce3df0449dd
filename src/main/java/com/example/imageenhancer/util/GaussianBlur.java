package com.example.imageenhancer.util;

import com.example.imageenhancer.model.Raster;

/**
 * Separable Gaussian smoothing with a replicate border. Only color channels are smoothed; alpha is
 * copied through unchanged.
 */
public final class GaussianBlur {

    private GaussianBlur() {
    }

    /**
     * Normalized one dimensional kernel of radius {@code max(1, ceil(3 * sigma))}.
     */
    public static double[] kernel(double sigma) {
        if (!(sigma > 0.0)) {
            throw new IllegalArgumentException("Gaussian sigma must be positive, got " + sigma);
        }
        int radius = Math.max(1, (int) Math.ceil(3.0 * sigma));
        double[] weights = new double[2 * radius + 1];
        double denominator = 2.0 * sigma * sigma;
        double sum = 0.0;
        for (int i = -radius; i <= radius; i++) {
            double weight = Math.exp(-(i * i) / denominator);
            weights[i + radius] = weight;
            sum += weight;
        }
        for (int i = 0; i < weights.length; i++) {
            weights[i] /= sum;
        }
        return weights;
    }

    public static float[] blur(Raster source, double sigma) {
        return convolve(source, kernel(sigma));
    }

    /**
     * Applies {@code kernel} horizontally, then vertically.
     */
    public static float[] convolve(Raster source, double[] kernel) {
        int height = source.height();
        int width = source.width();
        int channels = source.channels();
        int colorChannels = source.colorChannels();
        int radius = kernel.length / 2;

        double[] horizontal = new double[source.sampleCount()];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int base = (y * width + x) * channels;
                for (int c = 0; c < colorChannels; c++) {
                    double acc = 0.0;
                    for (int k = -radius; k <= radius; k++) {
                        int sx = SampleMath.clamp(x + k, 0, width - 1);
                        acc += kernel[k + radius] * source.sample(y, sx, c);
                    }
                    horizontal[base + c] = acc;
                }
            }
        }

        float[] output = source.newSampleArray();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int base = (y * width + x) * channels;
                for (int c = 0; c < colorChannels; c++) {
                    double acc = 0.0;
                    for (int k = -radius; k <= radius; k++) {
                        int sy = SampleMath.clamp(y + k, 0, height - 1);
                        acc += kernel[k + radius] * horizontal[(sy * width + x) * channels + c];
                    }
                    output[base + c] = SampleMath.clampUnit(acc);
                }
                if (source.hasAlpha()) {
                    output[base + 3] = source.sample(y, x, 3);
                }
            }
        }
        return output;
    }
}
