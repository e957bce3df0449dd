package com.example.imageenhancer.model;

/**
 * Enhancement controls for one pipeline run. Every numeric field is clamped into its documented
 * range on construction; out-of-range input is tolerated rather than rejected and {@code NaN}
 * resolves to the field's identity value.
 *
 * @param scaleFactor         upscaling factor in {@code [1.0, 4.0]}, identity {@code 1.0}
 * @param interpolationMethod resampling kernel, {@link InterpolationMethod#BICUBIC} when null
 * @param brightness          multiplicative gain in {@code [0.5, 2.0]}, identity {@code 1.0}
 * @param contrast            stretch about the mean luma in {@code [0.5, 2.0]}, identity {@code 1.0}
 * @param saturation          chroma gain in {@code [0.0, 2.0]}, identity {@code 1.0}
 * @param sharpness           unsharp-mask amount in {@code [0.5, 3.0]}, identity {@code 1.0}
 * @param noiseReduction      denoising strength in {@code [0.0, 1.0]}, identity {@code 0.0}
 */
public record ParameterSet(
        double scaleFactor,
        InterpolationMethod interpolationMethod,
        double brightness,
        double contrast,
        double saturation,
        double sharpness,
        double noiseReduction) {

    public static final double MIN_SCALE_FACTOR = 1.0;
    public static final double MAX_SCALE_FACTOR = 4.0;
    public static final double MIN_TONE = 0.5;
    public static final double MAX_TONE = 2.0;
    public static final double MIN_SATURATION = 0.0;
    public static final double MAX_SATURATION = 2.0;
    public static final double MIN_SHARPNESS = 0.5;
    public static final double MAX_SHARPNESS = 3.0;
    public static final double MIN_NOISE_REDUCTION = 0.0;
    public static final double MAX_NOISE_REDUCTION = 1.0;

    public ParameterSet {
        scaleFactor = clamp(scaleFactor, MIN_SCALE_FACTOR, MAX_SCALE_FACTOR, 1.0);
        interpolationMethod = interpolationMethod == null ? InterpolationMethod.BICUBIC : interpolationMethod;
        brightness = clamp(brightness, MIN_TONE, MAX_TONE, 1.0);
        contrast = clamp(contrast, MIN_TONE, MAX_TONE, 1.0);
        saturation = clamp(saturation, MIN_SATURATION, MAX_SATURATION, 1.0);
        sharpness = clamp(sharpness, MIN_SHARPNESS, MAX_SHARPNESS, 1.0);
        noiseReduction = clamp(noiseReduction, MIN_NOISE_REDUCTION, MAX_NOISE_REDUCTION, 0.0);
    }

    /**
     * Parameters under which every stage is a no-op.
     */
    public static ParameterSet identity() {
        return new ParameterSet(1.0, InterpolationMethod.BICUBIC, 1.0, 1.0, 1.0, 1.0, 0.0);
    }

    /**
     * Starting values offered to a user: double the resolution with bicubic resampling, leave
     * everything else untouched.
     */
    public static ParameterSet defaults() {
        return identity().withScaleFactor(2.0);
    }

    public ParameterSet withScaleFactor(double value) {
        return new ParameterSet(value, interpolationMethod, brightness, contrast, saturation, sharpness, noiseReduction);
    }

    public ParameterSet withInterpolationMethod(InterpolationMethod value) {
        return new ParameterSet(scaleFactor, value, brightness, contrast, saturation, sharpness, noiseReduction);
    }

    public ParameterSet withBrightness(double value) {
        return new ParameterSet(scaleFactor, interpolationMethod, value, contrast, saturation, sharpness, noiseReduction);
    }

    public ParameterSet withContrast(double value) {
        return new ParameterSet(scaleFactor, interpolationMethod, brightness, value, saturation, sharpness, noiseReduction);
    }

    public ParameterSet withSaturation(double value) {
        return new ParameterSet(scaleFactor, interpolationMethod, brightness, contrast, value, sharpness, noiseReduction);
    }

    public ParameterSet withSharpness(double value) {
        return new ParameterSet(scaleFactor, interpolationMethod, brightness, contrast, saturation, value, noiseReduction);
    }

    public ParameterSet withNoiseReduction(double value) {
        return new ParameterSet(scaleFactor, interpolationMethod, brightness, contrast, saturation, sharpness, value);
    }

    public boolean isToneIdentity() {
        return brightness == 1.0 && contrast == 1.0 && saturation == 1.0;
    }

    private static double clamp(double value, double min, double max, double identity) {
        if (Double.isNaN(value)) {
            return identity;
        }
        return Math.max(min, Math.min(max, value));
    }
}
