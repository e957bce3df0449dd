package com.example.imageenhancer.model;

/**
 * Encoded result handed back to the caller of the I/O facade.
 *
 * @param fileName   suggested download name, e.g. {@code enhanced_photo.png}
 * @param format     encoding of {@code content}
 * @param content    encoded image bytes
 * @param statistics before/after comparison of the run
 */
public record EnhancedImage(String fileName, ImageFormat format, byte[] content, StatisticsComparison statistics) {
}
