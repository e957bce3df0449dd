package com.example.imageenhancer.runner;

import com.example.imageenhancer.model.EnhancedImage;
import com.example.imageenhancer.model.ImageFormat;
import com.example.imageenhancer.model.InterpolationMethod;
import com.example.imageenhancer.model.ParameterSet;
import com.example.imageenhancer.model.StatisticsComparison;
import com.example.imageenhancer.service.ImageEnhancementService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;

/**
 * Enhances a single file when the application is started with {@code --input=<path>}. Optional
 * arguments: {@code --output}, {@code --format}, {@code --scale}, {@code --interpolation},
 * {@code --brightness}, {@code --contrast}, {@code --saturation}, {@code --sharpness} and
 * {@code --noise-reduction}. Anything not given falls back to the configured defaults.
 */
@Component
public class EnhanceFileRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(EnhanceFileRunner.class);

    private final ImageEnhancementService service;

    public EnhanceFileRunner(ImageEnhancementService service) {
        this.service = service;
    }

    @Override
    public void run(ApplicationArguments args) {
        String input = option(args, "input");
        if (input == null) {
            log.debug("No --input argument given, nothing to enhance");
            return;
        }
        Path inputPath = Paths.get(input);
        ParameterSet parameters = parameters(args, service.defaultParameters());
        String format = option(args, "format");
        ImageFormat outputFormat = format == null ? null : ImageFormat.fromExtension(format)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unsupported output format '" + format + "', expected one of " + ImageFormat.supportedExtensions()));

        EnhancedImage enhanced = enhance(inputPath, parameters, outputFormat);
        Path outputPath = resolveOutput(args, inputPath, enhanced.fileName());
        try {
            Files.write(outputPath, enhanced.content());
        } catch (IOException e) {
            log.error("Failed to write enhanced image {}", outputPath, e);
            throw new IllegalStateException("Failed to write enhanced image " + outputPath, e);
        }
        log.info("Wrote {}", outputPath);
        report(enhanced.statistics());
    }

    EnhancedImage enhance(Path inputPath, ParameterSet parameters, ImageFormat outputFormat) {
        byte[] content;
        try {
            content = Files.readAllBytes(inputPath);
        } catch (IOException e) {
            log.error("Failed to read image {}", inputPath, e);
            throw new IllegalStateException("Failed to read image " + inputPath, e);
        }
        Path fileName = inputPath.getFileName();
        return service.enhance(fileName != null ? fileName.toString() : inputPath.toString(), content, parameters, outputFormat);
    }

    static ParameterSet parameters(ApplicationArguments args, ParameterSet defaults) {
        ParameterSet parameters = defaults;
        Double scale = number(args, "scale");
        if (scale != null) {
            parameters = parameters.withScaleFactor(scale);
        }
        String interpolation = option(args, "interpolation");
        if (interpolation != null) {
            parameters = parameters.withInterpolationMethod(InterpolationMethod.fromName(interpolation));
        }
        Double brightness = number(args, "brightness");
        if (brightness != null) {
            parameters = parameters.withBrightness(brightness);
        }
        Double contrast = number(args, "contrast");
        if (contrast != null) {
            parameters = parameters.withContrast(contrast);
        }
        Double saturation = number(args, "saturation");
        if (saturation != null) {
            parameters = parameters.withSaturation(saturation);
        }
        Double sharpness = number(args, "sharpness");
        if (sharpness != null) {
            parameters = parameters.withSharpness(sharpness);
        }
        Double noiseReduction = number(args, "noise-reduction");
        if (noiseReduction != null) {
            parameters = parameters.withNoiseReduction(noiseReduction);
        }
        return parameters;
    }

    private static Path resolveOutput(ApplicationArguments args, Path inputPath, String downloadName) {
        String output = option(args, "output");
        if (output != null) {
            return Paths.get(output);
        }
        Path parent = inputPath.toAbsolutePath().getParent();
        return parent != null ? parent.resolve(downloadName) : Paths.get(downloadName);
    }

    private void report(StatisticsComparison comparison) {
        log.info(String.format(Locale.ROOT, "%-16s %14s %14s", "Metric", "Original", "Enhanced"));
        for (StatisticsComparison.Row row : comparison.rows()) {
            log.info(String.format(Locale.ROOT, "%-16s %14s %14s", row.metric(), row.original(), row.enhanced()));
        }
        log.info("Enhancement summary: {}", comparison.summary());
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        String value = values.get(values.size() - 1);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static Double number(ApplicationArguments args, String name) {
        String value = option(args, name);
        if (value == null) {
            return null;
        }
        try {
            return Double.valueOf(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Option --" + name + " expects a number but got '" + value + "'", e);
        }
    }
}
