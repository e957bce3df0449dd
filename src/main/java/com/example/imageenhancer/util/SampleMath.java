package com.example.imageenhancer.util;

import com.example.imageenhancer.model.Raster;

/**
 * Small numeric helpers shared by the enhancement stages.
 */
public final class SampleMath {

    public static final double LUMA_RED = 0.299;
    public static final double LUMA_GREEN = 0.587;
    public static final double LUMA_BLUE = 0.114;

    private SampleMath() {
    }

    public static float clampUnit(double value) {
        if (value <= 0.0) {
            return 0f;
        }
        if (value >= 1.0) {
            return 1f;
        }
        return (float) value;
    }

    public static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    public static double luma(double red, double green, double blue) {
        return LUMA_RED * red + LUMA_GREEN * green + LUMA_BLUE * blue;
    }

    /**
     * Luma of one pixel; single channel rasters are their own luma.
     */
    public static double luma(Raster raster, int y, int x) {
        if (raster.colorChannels() < 3) {
            return raster.sample(y, x, 0);
        }
        return luma(raster.sample(y, x, 0), raster.sample(y, x, 1), raster.sample(y, x, 2));
    }

    /**
     * Linear blend {@code (1 - t) * from + t * to} of two equally sized sample arrays.
     */
    public static float[] crossFade(float[] from, float[] to, double t) {
        if (from.length != to.length) {
            throw new IllegalArgumentException("Cannot blend arrays of different length");
        }
        float[] blended = new float[from.length];
        for (int i = 0; i < from.length; i++) {
            blended[i] = clampUnit(from[i] + (to[i] - from[i]) * t);
        }
        return blended;
    }
}
