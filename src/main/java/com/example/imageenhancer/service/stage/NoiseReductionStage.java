package com.example.imageenhancer.service.stage;

import com.example.imageenhancer.model.ParameterSet;
import com.example.imageenhancer.model.Raster;
import com.example.imageenhancer.util.GaussianBlur;
import com.example.imageenhancer.util.SampleMath;

import java.util.Arrays;

/**
 * Strength driven denoising. The strength selects one of three algorithm families:
 * <ul>
 *     <li>{@code (0, 0.3]} light: isotropic Gaussian with {@code sigma = 2 * strength}</li>
 *     <li>{@code (0.3, 0.6]} medium: bilateral filter</li>
 *     <li>{@code (0.6, 1.0]} heavy: non-local means</li>
 * </ul>
 * Upper limits are inclusive. Inside the medium and heavy bands the result is cross-faded from the
 * terminal output of the band below, so the output varies continuously with strength even where
 * the algorithm changes. Alpha is never filtered.
 */
public class NoiseReductionStage implements EnhancementStage {

    public static final double LIGHT_UPPER = 0.3;
    public static final double MEDIUM_UPPER = 0.6;
    public static final double HEAVY_UPPER = 1.0;

    private final Settings settings;

    public NoiseReductionStage() {
        this(Settings.defaults());
    }

    public NoiseReductionStage(Settings settings) {
        this.settings = settings;
    }

    public Settings settings() {
        return settings;
    }

    @Override
    public String name() {
        return "denoise";
    }

    @Override
    public Raster apply(Raster input, ParameterSet parameters) {
        return denoise(input, parameters.noiseReduction());
    }

    public Raster denoise(Raster input, double strength) {
        if (!(strength > 0.0)) {
            return input;
        }
        double clamped = Math.min(HEAVY_UPPER, strength);
        float[] output;
        if (clamped <= LIGHT_UPPER) {
            output = light(input, clamped);
        } else if (clamped <= MEDIUM_UPPER) {
            output = medium(input, clamped);
        } else {
            output = heavy(input, clamped);
        }
        return Raster.wrap(input.height(), input.width(), input.channels(), output);
    }

    /**
     * Band a strength value falls into.
     */
    public static Band bandOf(double strength) {
        if (!(strength > 0.0)) {
            return Band.NONE;
        }
        if (strength <= LIGHT_UPPER) {
            return Band.LIGHT;
        }
        if (strength <= MEDIUM_UPPER) {
            return Band.MEDIUM;
        }
        return Band.HEAVY;
    }

    private float[] light(Raster input, double strength) {
        return GaussianBlur.blur(input, 2.0 * strength);
    }

    private float[] medium(Raster input, double strength) {
        double t = (strength - LIGHT_UPPER) / (MEDIUM_UPPER - LIGHT_UPPER);
        float[] bilateral = bilateral(input, 2.0 * strength, rangeSigma(t));
        if (t >= 1.0) {
            return bilateral;
        }
        return SampleMath.crossFade(light(input, LIGHT_UPPER), bilateral, t);
    }

    private float[] heavy(Raster input, double strength) {
        double t = (strength - MEDIUM_UPPER) / (HEAVY_UPPER - MEDIUM_UPPER);
        int searchRadius = settings.minSearchRadius()
                + (int) Math.round((settings.maxSearchRadius() - settings.minSearchRadius()) * t);
        double h = settings.minFilterStrength() + (settings.maxFilterStrength() - settings.minFilterStrength()) * t;
        float[] nonLocal = nonLocalMeans(input, settings.patchRadius(), searchRadius, h);
        return SampleMath.crossFade(medium(input, MEDIUM_UPPER), nonLocal, t);
    }

    private double rangeSigma(double t) {
        return settings.minRangeSigma() + (settings.maxRangeSigma() - settings.minRangeSigma()) * t;
    }

    private float[] bilateral(Raster input, double spatialSigma, double rangeSigma) {
        int height = input.height();
        int width = input.width();
        int channels = input.channels();
        int colorChannels = input.colorChannels();
        int radius = Math.max(1, (int) Math.ceil(3.0 * spatialSigma));
        double spatialDenominator = 2.0 * spatialSigma * spatialSigma;
        double rangeDenominator = 2.0 * rangeSigma * rangeSigma;

        double[] spatial = new double[(2 * radius + 1) * (2 * radius + 1)];
        for (int dy = -radius; dy <= radius; dy++) {
            for (int dx = -radius; dx <= radius; dx++) {
                spatial[(dy + radius) * (2 * radius + 1) + dx + radius] = Math.exp(-(dx * dx + dy * dy) / spatialDenominator);
            }
        }

        float[] output = input.samples();
        double[] acc = new double[colorChannels];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                Arrays.fill(acc, 0.0);
                double total = 0.0;
                for (int dy = -radius; dy <= radius; dy++) {
                    int sy = SampleMath.clamp(y + dy, 0, height - 1);
                    for (int dx = -radius; dx <= radius; dx++) {
                        int sx = SampleMath.clamp(x + dx, 0, width - 1);
                        double distance = 0.0;
                        for (int c = 0; c < colorChannels; c++) {
                            double diff = input.sample(sy, sx, c) - input.sample(y, x, c);
                            distance += diff * diff;
                        }
                        double weight = spatial[(dy + radius) * (2 * radius + 1) + dx + radius]
                                * Math.exp(-distance / rangeDenominator);
                        for (int c = 0; c < colorChannels; c++) {
                            acc[c] += weight * input.sample(sy, sx, c);
                        }
                        total += weight;
                    }
                }
                int base = (y * width + x) * channels;
                for (int c = 0; c < colorChannels; c++) {
                    output[base + c] = SampleMath.clampUnit(acc[c] / total);
                }
            }
        }
        return output;
    }

    /**
     * Pixelwise non-local means. For every offset in the search window the squared patch distance
     * of all pixels is obtained from an integral image of per-pixel differences, so the cost is
     * independent of the patch size. Patch windows are truncated at the image border.
     */
    private float[] nonLocalMeans(Raster input, int patchRadius, int searchRadius, double h) {
        int height = input.height();
        int width = input.width();
        int channels = input.channels();
        int colorChannels = input.colorChannels();
        int pixels = height * width;
        double filter = h * h;

        double[] numerator = new double[pixels * colorChannels];
        double[] denominator = new double[pixels];
        double[] difference = new double[pixels];
        double[] integral = new double[(height + 1) * (width + 1)];

        for (int oy = -searchRadius; oy <= searchRadius; oy++) {
            for (int ox = -searchRadius; ox <= searchRadius; ox++) {
                for (int y = 0; y < height; y++) {
                    int sy = SampleMath.clamp(y + oy, 0, height - 1);
                    for (int x = 0; x < width; x++) {
                        int sx = SampleMath.clamp(x + ox, 0, width - 1);
                        double sum = 0.0;
                        for (int c = 0; c < colorChannels; c++) {
                            double diff = input.sample(y, x, c) - input.sample(sy, sx, c);
                            sum += diff * diff;
                        }
                        difference[y * width + x] = sum / colorChannels;
                    }
                }
                integrate(difference, integral, height, width);

                for (int y = 0; y < height; y++) {
                    int top = Math.max(0, y - patchRadius);
                    int bottom = Math.min(height - 1, y + patchRadius);
                    int sy = SampleMath.clamp(y + oy, 0, height - 1);
                    for (int x = 0; x < width; x++) {
                        int left = Math.max(0, x - patchRadius);
                        int right = Math.min(width - 1, x + patchRadius);
                        double area = (bottom - top + 1) * (double) (right - left + 1);
                        double patchDistance = boxSum(integral, width, top, left, bottom, right) / area;
                        double weight = Math.exp(-patchDistance / filter);
                        int sx = SampleMath.clamp(x + ox, 0, width - 1);
                        int pixel = y * width + x;
                        for (int c = 0; c < colorChannels; c++) {
                            numerator[pixel * colorChannels + c] += weight * input.sample(sy, sx, c);
                        }
                        denominator[pixel] += weight;
                    }
                }
            }
        }

        float[] output = input.samples();
        for (int pixel = 0; pixel < pixels; pixel++) {
            for (int c = 0; c < colorChannels; c++) {
                output[pixel * channels + c] = SampleMath.clampUnit(numerator[pixel * colorChannels + c] / denominator[pixel]);
            }
        }
        return output;
    }

    private static void integrate(double[] values, double[] integral, int height, int width) {
        int stride = width + 1;
        for (int y = 0; y < height; y++) {
            double row = 0.0;
            for (int x = 0; x < width; x++) {
                row += values[y * width + x];
                integral[(y + 1) * stride + x + 1] = integral[y * stride + x + 1] + row;
            }
        }
    }

    private static double boxSum(double[] integral, int width, int top, int left, int bottom, int right) {
        int stride = width + 1;
        return integral[(bottom + 1) * stride + right + 1]
                - integral[top * stride + right + 1]
                - integral[(bottom + 1) * stride + left]
                + integral[top * stride + left];
    }

    public enum Band {
        NONE,
        LIGHT,
        MEDIUM,
        HEAVY
    }

    /**
     * Fixed constants of the medium and heavy bands. Range sigma and the non-local means filter
     * strength are in normalized sample units and are interpolated across their band.
     *
     * @param minRangeSigma     bilateral range sigma at the bottom of the medium band
     * @param maxRangeSigma     bilateral range sigma at the top of the medium band
     * @param patchRadius       non-local means patch radius, 3 gives 7x7 patches
     * @param minSearchRadius   search radius at the bottom of the heavy band
     * @param maxSearchRadius   search radius at the top of the heavy band
     * @param minFilterStrength non-local means {@code h} at the bottom of the heavy band
     * @param maxFilterStrength non-local means {@code h} at the top of the heavy band
     */
    public record Settings(
            double minRangeSigma,
            double maxRangeSigma,
            int patchRadius,
            int minSearchRadius,
            int maxSearchRadius,
            double minFilterStrength,
            double maxFilterStrength) {

        public Settings {
            if (!(minRangeSigma > 0.0) || maxRangeSigma < minRangeSigma) {
                throw new IllegalArgumentException("Range sigma bounds must satisfy 0 < min <= max");
            }
            if (patchRadius < 1) {
                throw new IllegalArgumentException("Patch radius must be at least 1");
            }
            if (minSearchRadius < 1 || maxSearchRadius < minSearchRadius) {
                throw new IllegalArgumentException("Search radius bounds must satisfy 1 <= min <= max");
            }
            if (!(minFilterStrength > 0.0) || maxFilterStrength < minFilterStrength) {
                throw new IllegalArgumentException("Filter strength bounds must satisfy 0 < min <= max");
            }
        }

        public static Settings defaults() {
            return new Settings(0.1, 0.3, 3, 5, 10, 0.04, 0.1);
        }
    }
}
