package com.example.imageenhancer.service.stage;

import com.example.imageenhancer.TestRasters;
import com.example.imageenhancer.model.Raster;
import com.example.imageenhancer.service.stage.NoiseReductionStage.Band;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NoiseReductionStageTest {

    private final NoiseReductionStage stage = new NoiseReductionStage();

    @Test
    void bandBoundariesAreInclusiveAtTheUpperLimit() {
        assertThat(NoiseReductionStage.bandOf(0.0)).isEqualTo(Band.NONE);
        assertThat(NoiseReductionStage.bandOf(0.01)).isEqualTo(Band.LIGHT);
        assertThat(NoiseReductionStage.bandOf(0.3)).isEqualTo(Band.LIGHT);
        assertThat(NoiseReductionStage.bandOf(0.31)).isEqualTo(Band.MEDIUM);
        assertThat(NoiseReductionStage.bandOf(0.6)).isEqualTo(Band.MEDIUM);
        assertThat(NoiseReductionStage.bandOf(0.61)).isEqualTo(Band.HEAVY);
        assertThat(NoiseReductionStage.bandOf(1.0)).isEqualTo(Band.HEAVY);
        assertThat(NoiseReductionStage.bandOf(Double.NaN)).isEqualTo(Band.NONE);
    }

    @Test
    void zeroStrengthReturnsInput() {
        Raster input = TestRasters.random(4, 4, 3, 1L);

        assertThat(stage.denoise(input, 0.0)).isSameAs(input);
    }

    @Test
    void outputIsContinuousAcrossLightToMediumBoundary() {
        Raster input = TestRasters.noisyGradient(20, 20, 3, 0.08, 21L);

        Raster below = stage.denoise(input, 0.29);
        Raster at = stage.denoise(input, 0.30);
        Raster above = stage.denoise(input, 0.31);

        assertThat(TestRasters.maxAbsoluteDifference(below, at)).isLessThan(0.06);
        assertThat(TestRasters.maxAbsoluteDifference(at, above)).isLessThan(0.06);
        assertThat(TestRasters.meanAbsoluteDifference(at, above)).isLessThan(0.01);
    }

    @Test
    void outputIsContinuousAcrossMediumToHeavyBoundary() {
        Raster input = TestRasters.noisyGradient(20, 20, 3, 0.08, 22L);

        Raster below = stage.denoise(input, 0.59);
        Raster at = stage.denoise(input, 0.60);
        Raster above = stage.denoise(input, 0.61);

        assertThat(TestRasters.maxAbsoluteDifference(below, at)).isLessThan(0.06);
        assertThat(TestRasters.maxAbsoluteDifference(at, above)).isLessThan(0.06);
        assertThat(TestRasters.meanAbsoluteDifference(at, above)).isLessThan(0.01);
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.2, 0.5, 0.9})
    void everyBandReducesNoise(double strength) {
        Raster input = TestRasters.noisyFlat(16, 16, 3, 0.5, 0.2, 31L);

        Raster output = stage.denoise(input, strength);

        assertThat(TestRasters.standardDeviation(output)).isLessThan(TestRasters.standardDeviation(input));
        assertThat(TestRasters.withinUnitRange(output)).isTrue();
    }

    @ParameterizedTest
    @CsvSource({"0.1, 0.2", "0.4, 0.5", "0.7, 0.9"})
    void smoothingGrowsContinuouslyWithinBand(double weaker, double stronger) {
        Raster input = TestRasters.noisyFlat(16, 16, 3, 0.5, 0.2, 31L);
        assertThat(NoiseReductionStage.bandOf(weaker)).isEqualTo(NoiseReductionStage.bandOf(stronger));

        Raster weak = stage.denoise(input, weaker);
        Raster strong = stage.denoise(input, stronger);

        assertThat(TestRasters.maxAbsoluteDifference(weak, strong)).isGreaterThan(1e-4);
        assertThat(TestRasters.standardDeviation(strong)).isLessThan(TestRasters.standardDeviation(weak));
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.2, 0.5, 0.9})
    void constantFieldIsFixed(double strength) {
        Raster input = Raster.filled(6, 6, 3, 0f);

        assertThat(stage.denoise(input, strength)).isEqualTo(input);
    }

    @Test
    void alphaIsNeverFiltered() {
        Raster input = TestRasters.random(8, 8, 4, 41L);

        Raster output = stage.denoise(input, 0.8);

        for (int y = 0; y < 8; y++) {
            for (int x = 0; x < 8; x++) {
                assertThat(output.sample(y, x, 3)).isEqualTo(input.sample(y, x, 3));
            }
        }
    }

    @Test
    void repeatedCallsAreIdentical() {
        Raster input = TestRasters.noisyGradient(10, 10, 1, 0.1, 51L);

        assertThat(stage.denoise(input, 0.75)).isEqualTo(stage.denoise(input, 0.75));
    }

    @Test
    void settingsRejectInvertedBounds() {
        assertThatThrownBy(() -> new NoiseReductionStage.Settings(0.3, 0.1, 3, 5, 10, 0.04, 0.1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Range sigma");
        assertThatThrownBy(() -> new NoiseReductionStage.Settings(0.1, 0.3, 3, 10, 5, 0.04, 0.1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Search radius");
    }
}
