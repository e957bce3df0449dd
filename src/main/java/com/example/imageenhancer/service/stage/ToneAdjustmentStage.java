package com.example.imageenhancer.service.stage;

import com.example.imageenhancer.model.ParameterSet;
import com.example.imageenhancer.model.Raster;
import com.example.imageenhancer.util.SampleMath;

/**
 * Brightness, contrast and saturation, applied in that order. Each adjustment reads the clamped
 * result of the previous one. Contrast stretches linearly about the mean luma of the brightened
 * image, so a uniform image keeps its value; saturation blends every color sample with the
 * pixel's luma and is skipped for grayscale rasters.
 */
public class ToneAdjustmentStage implements EnhancementStage {

    @Override
    public String name() {
        return "tone";
    }

    @Override
    public Raster apply(Raster input, ParameterSet parameters) {
        if (parameters.isToneIdentity()) {
            return input;
        }
        return adjust(input, parameters.brightness(), parameters.contrast(), parameters.saturation());
    }

    public Raster adjust(Raster input, double brightness, double contrast, double saturation) {
        boolean adjustSaturation = saturation != 1.0 && input.colorChannels() >= 3;
        if (brightness == 1.0 && contrast == 1.0 && !adjustSaturation) {
            return input;
        }

        int channels = input.channels();
        int colorChannels = input.colorChannels();
        float[] output = input.samples();
        if (brightness != 1.0) {
            for (int base = 0; base < output.length; base += channels) {
                for (int c = 0; c < colorChannels; c++) {
                    output[base + c] = SampleMath.clampUnit(output[base + c] * brightness);
                }
            }
        }
        double pivot = contrast != 1.0 ? meanLuma(output, channels) : 0.0;

        double[] pixel = new double[colorChannels];
        for (int base = 0; base < output.length; base += channels) {
            for (int c = 0; c < colorChannels; c++) {
                double value = output[base + c];
                if (contrast != 1.0) {
                    value = SampleMath.clampUnit(pivot + (value - pivot) * contrast);
                }
                pixel[c] = value;
            }
            if (adjustSaturation) {
                double luma = SampleMath.luma(pixel[0], pixel[1], pixel[2]);
                for (int c = 0; c < 3; c++) {
                    pixel[c] = luma + (pixel[c] - luma) * saturation;
                }
            }
            for (int c = 0; c < colorChannels; c++) {
                output[base + c] = SampleMath.clampUnit(pixel[c]);
            }
        }
        return Raster.wrap(input.height(), input.width(), channels, output);
    }

    private static double meanLuma(float[] samples, int channels) {
        double sum = 0.0;
        int pixels = 0;
        for (int base = 0; base < samples.length; base += channels) {
            sum += channels >= 3
                    ? SampleMath.luma(samples[base], samples[base + 1], samples[base + 2])
                    : samples[base];
            pixels++;
        }
        return sum / pixels;
    }
}
