package com.example.imageenhancer.model;

import java.util.Locale;

/**
 * Resampling kernels available to the upscaling stage.
 */
public enum InterpolationMethod {
    NEAREST,
    BILINEAR,
    BICUBIC,
    LANCZOS;

    /**
     * Resolves a user supplied name such as {@code "Bicubic"} or {@code "lanczos"}, falling back to
     * {@link #BICUBIC} for blank or unknown values.
     */
    public static InterpolationMethod fromName(String name) {
        if (name == null || name.isBlank()) {
            return BICUBIC;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return BICUBIC;
        }
    }
}
