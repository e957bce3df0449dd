package com.example.imageenhancer.service;

import com.example.imageenhancer.model.Raster;
import com.example.imageenhancer.model.StatisticsRecord;
import com.example.imageenhancer.util.SampleMath;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes descriptive statistics of a raster. Values are reported in 8-bit sample units.
 * Per-channel figures cover every channel; the global min, max, mean and deviation ignore alpha.
 * <p>
 * The sharpness score is the variance of the 4-neighbour Laplacian of luma with a replicate
 * border; it is zero for constant images and grows with the amount of fine detail. The entropy is
 * the Shannon entropy, in bits, of the 256-bin luma histogram.
 */
@Component
public class StatisticsExtractor {

    private static final int HISTOGRAM_BINS = 256;

    public StatisticsRecord stats(Raster raster) {
        int channels = raster.channels();
        long pixels = raster.pixelCount();

        double[] sums = new double[channels];
        double[] squares = new double[channels];
        int colorChannels = raster.colorChannels();
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (int i = 0; i < raster.sampleCount(); i++) {
            double value = raster.sampleAt(i) * (double) Raster.MAX_SAMPLE_VALUE;
            int channel = i % channels;
            sums[channel] += value;
            squares[channel] += value * value;
            if (channel < colorChannels) {
                min = Math.min(min, value);
                max = Math.max(max, value);
            }
        }

        List<Double> means = new ArrayList<>(channels);
        List<Double> deviations = new ArrayList<>(channels);
        double totalSum = 0.0;
        double totalSquares = 0.0;
        for (int c = 0; c < channels; c++) {
            means.add(sums[c] / pixels);
            deviations.add(standardDeviation(sums[c], squares[c], pixels));
            if (c < colorChannels) {
                totalSum += sums[c];
                totalSquares += squares[c];
            }
        }
        long samples = (long) pixels * colorChannels;

        double[] luma = luma(raster);
        return new StatisticsRecord(
                raster.width(),
                raster.height(),
                channels,
                means,
                deviations,
                min,
                max,
                totalSum / samples,
                standardDeviation(totalSum, totalSquares, samples),
                laplacianVariance(luma, raster.height(), raster.width()),
                entropy(luma));
    }

    private static double standardDeviation(double sum, double squares, long count) {
        double mean = sum / count;
        double variance = squares / count - mean * mean;
        return variance > 0.0 ? Math.sqrt(variance) : 0.0;
    }

    private static double[] luma(Raster raster) {
        int height = raster.height();
        int width = raster.width();
        double[] luma = new double[height * width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                luma[y * width + x] = SampleMath.luma(raster, y, x) * Raster.MAX_SAMPLE_VALUE;
            }
        }
        return luma;
    }

    private static double laplacianVariance(double[] luma, int height, int width) {
        double sum = 0.0;
        double squares = 0.0;
        for (int y = 0; y < height; y++) {
            int up = Math.max(0, y - 1);
            int down = Math.min(height - 1, y + 1);
            for (int x = 0; x < width; x++) {
                int left = Math.max(0, x - 1);
                int right = Math.min(width - 1, x + 1);
                double laplacian = luma[up * width + x] + luma[down * width + x]
                        + luma[y * width + left] + luma[y * width + right]
                        - 4.0 * luma[y * width + x];
                sum += laplacian;
                squares += laplacian * laplacian;
            }
        }
        long count = (long) height * width;
        double mean = sum / count;
        double variance = squares / count - mean * mean;
        return Math.max(0.0, variance);
    }

    private static double entropy(double[] luma) {
        long[] histogram = new long[HISTOGRAM_BINS];
        for (double value : luma) {
            int bin = SampleMath.clamp((int) Math.round(value), 0, HISTOGRAM_BINS - 1);
            histogram[bin]++;
        }
        double entropy = 0.0;
        for (long count : histogram) {
            if (count == 0) {
                continue;
            }
            double p = count / (double) luma.length;
            entropy -= p * (Math.log(p) / Math.log(2.0));
        }
        return entropy;
    }
}
