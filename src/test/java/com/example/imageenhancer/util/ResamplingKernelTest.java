package com.example.imageenhancer.util;

import com.example.imageenhancer.model.InterpolationMethod;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ResamplingKernelTest {

    @ParameterizedTest
    @EnumSource(ResamplingKernel.class)
    void interpolatesAtIntegerOffsets(ResamplingKernel kernel) {
        assertThat(kernel.weight(0.0)).isCloseTo(1.0, within(1e-12));
        for (int offset = 1; offset <= kernel.radius(); offset++) {
            assertThat(kernel.weight(offset)).isCloseTo(0.0, within(1e-12));
            assertThat(kernel.weight(-offset)).isCloseTo(0.0, within(1e-12));
        }
        assertThat(kernel.weight(kernel.radius() + 0.5)).isZero();
    }

    @ParameterizedTest
    @EnumSource(ResamplingKernel.class)
    void isSymmetric(ResamplingKernel kernel) {
        for (double x = 0.05; x < kernel.radius(); x += 0.1) {
            assertThat(kernel.weight(-x)).isCloseTo(kernel.weight(x), within(1e-12));
        }
    }

    @Test
    void cubicHasNegativeLobe() {
        assertThat(ResamplingKernel.CUBIC.weight(1.5)).isCloseTo(-0.0625, within(1e-12));
        assertThat(ResamplingKernel.CUBIC.weight(0.5)).isCloseTo(0.5625, within(1e-12));
    }

    @Test
    void mapsFilteredMethods() {
        assertThat(ResamplingKernel.forMethod(InterpolationMethod.BILINEAR)).isEqualTo(ResamplingKernel.TRIANGLE);
        assertThat(ResamplingKernel.forMethod(InterpolationMethod.BICUBIC)).isEqualTo(ResamplingKernel.CUBIC);
        assertThat(ResamplingKernel.forMethod(InterpolationMethod.LANCZOS)).isEqualTo(ResamplingKernel.LANCZOS3);
        assertThatThrownBy(() -> ResamplingKernel.forMethod(InterpolationMethod.NEAREST))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
