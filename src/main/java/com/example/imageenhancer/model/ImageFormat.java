package com.example.imageenhancer.model;

import com.example.imageenhancer.exception.InvalidImageInputException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Encodings accepted at the I/O boundary. Formats are recognised by file extension.
 */
public enum ImageFormat {
    PNG("png", List.of("png")),
    JPEG("jpeg", List.of("jpeg", "jpg")),
    TIFF("tiff", List.of("tiff", "tif"));

    private final String imageIoName;
    private final List<String> extensions;

    ImageFormat(String imageIoName, List<String> extensions) {
        this.imageIoName = imageIoName;
        this.extensions = extensions;
    }

    public String imageIoName() {
        return imageIoName;
    }

    public String defaultExtension() {
        return extensions.get(0);
    }

    public boolean supportsAlpha() {
        return this != JPEG;
    }

    public static Optional<ImageFormat> fromExtension(String extension) {
        if (extension == null || extension.isBlank()) {
            return Optional.empty();
        }
        String normalized = extension.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        for (ImageFormat format : values()) {
            if (format.extensions.contains(normalized)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }

    public static Optional<ImageFormat> fromFileName(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return Optional.empty();
        }
        return fromExtension(fileName.substring(dot + 1));
    }

    /**
     * Resolves the format of an uploaded file or fails with the list of accepted extensions.
     */
    public static ImageFormat requireSupported(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            throw new InvalidImageInputException("No file uploaded");
        }
        return fromFileName(fileName).orElseThrow(() -> new InvalidImageInputException(
                "Unsupported format. Please upload: " + supportedExtensions()));
    }

    public static String supportedExtensions() {
        return Arrays.stream(values())
                .flatMap(format -> format.extensions.stream())
                .map(extension -> extension.toUpperCase(Locale.ROOT))
                .collect(Collectors.joining(", "));
    }
}
