package com.example.imageenhancer.exception;

/**
 * Raised when an image cannot enter the enhancement pipeline: the payload is not decodable, the
 * file format is not supported, the raster has no area or its channel layout is not one of
 * grayscale, RGB or RGBA. Always raised before any stage runs.
 */
public class InvalidImageInputException extends IllegalArgumentException {

    public InvalidImageInputException(String message) {
        super(message);
    }

    public InvalidImageInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
