package com.example.imageenhancer.service.stage;

import com.example.imageenhancer.model.ParameterSet;
import com.example.imageenhancer.model.Raster;
import com.example.imageenhancer.util.GaussianBlur;
import com.example.imageenhancer.util.SampleMath;

/**
 * Unsharp masking: {@code out = v + (v - blur(v)) * (amount - 1)}. Amounts above one amplify
 * detail, amounts below one soften it.
 */
public class SharpeningStage implements EnhancementStage {

    public static final double DEFAULT_SIGMA = 1.0;

    private final double sigma;

    public SharpeningStage() {
        this(DEFAULT_SIGMA);
    }

    public SharpeningStage(double sigma) {
        if (!(sigma > 0.0)) {
            throw new IllegalArgumentException("Sharpening sigma must be positive, got " + sigma);
        }
        this.sigma = sigma;
    }

    public double sigma() {
        return sigma;
    }

    @Override
    public String name() {
        return "sharpen";
    }

    @Override
    public Raster apply(Raster input, ParameterSet parameters) {
        return sharpen(input, parameters.sharpness());
    }

    public Raster sharpen(Raster input, double amount) {
        if (amount == 1.0) {
            return input;
        }
        double gain = amount - 1.0;
        float[] blurred = GaussianBlur.blur(input, sigma);
        float[] output = input.samples();
        int channels = input.channels();
        int colorChannels = input.colorChannels();
        for (int base = 0; base < output.length; base += channels) {
            for (int c = 0; c < colorChannels; c++) {
                double original = output[base + c];
                double detail = original - blurred[base + c];
                output[base + c] = SampleMath.clampUnit(original + detail * gain);
            }
        }
        return Raster.wrap(input.height(), input.width(), channels, output);
    }
}
