package com.example.imageenhancer.config;

import com.example.imageenhancer.model.ImageFormat;
import com.example.imageenhancer.model.InterpolationMethod;
import com.example.imageenhancer.model.ParameterSet;
import com.example.imageenhancer.service.stage.NoiseReductionStage;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Externalised settings bound from the {@code enhancer.*} namespace. User facing parameters are
 * only defaults here; the pipeline clamps whatever a caller supplies. Kernel constants are fixed
 * per deployment and never exposed to end users.
 */
@Validated
@ConfigurationProperties(prefix = "enhancer")
public record EnhancerProperties(
        @Valid @NotNull @DefaultValue Defaults defaults,
        @Valid @NotNull @DefaultValue Sharpening sharpening,
        @Valid @NotNull @DefaultValue NoiseReduction noiseReduction,
        @Valid @NotNull @DefaultValue Limits limits,
        @Valid @NotNull @DefaultValue Output output) {

    public record Defaults(
            @DefaultValue("2.0") double scaleFactor,
            @DefaultValue("BICUBIC") InterpolationMethod interpolation,
            @DefaultValue("1.0") double brightness,
            @DefaultValue("1.0") double contrast,
            @DefaultValue("1.0") double saturation,
            @DefaultValue("1.0") double sharpness,
            @DefaultValue("0.0") double noiseReduction) {

        public ParameterSet toParameterSet() {
            return new ParameterSet(scaleFactor, interpolation, brightness, contrast, saturation, sharpness, noiseReduction);
        }
    }

    public record Sharpening(
            @Positive @DecimalMax("5.0") @DefaultValue("1.0") double sigma) {
    }

    public record NoiseReduction(
            @Positive @DefaultValue("0.1") double minRangeSigma,
            @Positive @DefaultValue("0.3") double maxRangeSigma,
            @Min(1) @DefaultValue("3") int patchRadius,
            @Min(1) @DefaultValue("5") int minSearchRadius,
            @Min(1) @DefaultValue("10") int maxSearchRadius,
            @Positive @DefaultValue("0.04") double minFilterStrength,
            @Positive @DefaultValue("0.1") double maxFilterStrength) {

        public NoiseReductionStage.Settings toSettings() {
            return new NoiseReductionStage.Settings(minRangeSigma, maxRangeSigma, patchRadius,
                    minSearchRadius, maxSearchRadius, minFilterStrength, maxFilterStrength);
        }
    }

    public record Limits(
            @Positive @DefaultValue("268435456") long maxOutputSamples) {
    }

    public record Output(
            @NotNull @DefaultValue("PNG") ImageFormat format,
            @NotBlank @DefaultValue("enhanced_") String filePrefix) {
    }
}
