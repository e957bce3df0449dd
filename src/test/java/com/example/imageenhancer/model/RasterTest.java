package com.example.imageenhancer.model;

import com.example.imageenhancer.exception.InvalidImageInputException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RasterTest {

    @Test
    void shouldRejectZeroArea() {
        assertThatThrownBy(() -> Raster.of(0, 4, 3, new float[0]))
                .isInstanceOf(InvalidImageInputException.class)
                .hasMessageContaining("positive area");
    }

    @Test
    void shouldRejectUnsupportedChannelCount() {
        assertThatThrownBy(() -> Raster.of(2, 2, 2, new float[8]))
                .isInstanceOf(InvalidImageInputException.class)
                .hasMessageContaining("channel count 2");
    }

    @Test
    void shouldRejectSampleCountMismatch() {
        assertThatThrownBy(() -> Raster.of(2, 2, 3, new float[11]))
                .isInstanceOf(InvalidImageInputException.class)
                .hasMessageContaining("Expected 12 samples");
    }

    @Test
    void shouldRejectSamplesOutsideNormalizedRange() {
        assertThatThrownBy(() -> Raster.of(1, 2, 1, new float[]{0.5f, 1.5f}))
                .isInstanceOf(InvalidImageInputException.class);
        assertThatThrownBy(() -> Raster.of(1, 1, 1, new float[]{Float.NaN}))
                .isInstanceOf(InvalidImageInputException.class);
        assertThatThrownBy(() -> Raster.fromUnsigned8(1, 1, 1, 256))
                .isInstanceOf(InvalidImageInputException.class);
    }

    @Test
    void shouldExposeInterleavedSamples() {
        Raster raster = Raster.fromUnsigned8(1, 2, 4,
                10, 20, 30, 255,
                40, 50, 60, 0);

        assertThat(raster.hasAlpha()).isTrue();
        assertThat(raster.colorChannels()).isEqualTo(3);
        assertThat(raster.pixelCount()).isEqualTo(2);
        assertThat(raster.unsigned8(0, 1, 1)).isEqualTo(50);
        assertThat(raster.unsigned8(0, 0, 3)).isEqualTo(255);
        assertThat(raster.sample(0, 1, 3)).isZero();
    }

    @Test
    void shouldCopyCallerArray() {
        float[] samples = {0.25f, 0.75f};
        Raster raster = Raster.of(1, 2, 1, samples);

        samples[0] = 1f;
        raster.samples()[1] = 0f;

        assertThat(raster.sample(0, 0, 0)).isEqualTo(0.25f);
        assertThat(raster.sample(0, 1, 0)).isEqualTo(0.75f);
    }

    @Test
    void equalityComparesLayoutAndSamples() {
        Raster a = Raster.fromUnsigned8(2, 1, 1, 0, 255);
        Raster b = Raster.fromUnsigned8(2, 1, 1, 0, 255);
        Raster transposed = Raster.fromUnsigned8(1, 2, 1, 0, 255);

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a).isNotEqualTo(transposed);
    }
}
