package com.example.imageenhancer.util;

import com.example.imageenhancer.model.InterpolationMethod;

/**
 * Continuous reconstruction filters used for resampling. Each curve is defined on
 * {@code [-radius, radius]} and equals {@code 1.0} at the origin.
 */
public enum ResamplingKernel {

    /**
     * Tent filter, the separable form of bilinear interpolation.
     */
    TRIANGLE(1.0) {
        @Override
        public double weight(double x) {
            double ax = Math.abs(x);
            return ax < 1.0 ? 1.0 - ax : 0.0;
        }
    },

    /**
     * Keys cubic convolution with {@code a = -0.5} (Catmull-Rom).
     */
    CUBIC(2.0) {
        @Override
        public double weight(double x) {
            double ax = Math.abs(x);
            if (ax <= 1.0) {
                return (CUBIC_A + 2.0) * ax * ax * ax - (CUBIC_A + 3.0) * ax * ax + 1.0;
            }
            if (ax < 2.0) {
                return CUBIC_A * ax * ax * ax - 5.0 * CUBIC_A * ax * ax + 8.0 * CUBIC_A * ax - 4.0 * CUBIC_A;
            }
            return 0.0;
        }
    },

    /**
     * Sinc windowed by a three lobe sinc.
     */
    LANCZOS3(3.0) {
        @Override
        public double weight(double x) {
            double ax = Math.abs(x);
            if (ax < 1e-12) {
                return 1.0;
            }
            if (ax >= 3.0) {
                return 0.0;
            }
            double px = Math.PI * ax;
            return 3.0 * Math.sin(px) * Math.sin(px / 3.0) / (px * px);
        }
    };

    private static final double CUBIC_A = -0.5;

    private final double radius;

    ResamplingKernel(double radius) {
        this.radius = radius;
    }

    /**
     * Number of source pixels on each side of the sample position that contribute a weight.
     */
    public double radius() {
        return radius;
    }

    public abstract double weight(double x);

    /**
     * Kernel backing a filtered interpolation method; {@link InterpolationMethod#NEAREST} has no
     * kernel and is rejected.
     */
    public static ResamplingKernel forMethod(InterpolationMethod method) {
        switch (method) {
            case BILINEAR:
                return TRIANGLE;
            case BICUBIC:
                return CUBIC;
            case LANCZOS:
                return LANCZOS3;
            default:
                throw new IllegalArgumentException("No resampling kernel for " + method);
        }
    }
}
