package com.example.imageenhancer.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class StatisticsComparisonTest {

    private final StatisticsRecord before = record(100, 50, 120.0, 40.0, 12.0);
    private final StatisticsRecord after = record(200, 100, 130.5, 42.0, 30.0);

    @Test
    void shouldDeriveDeltas() {
        StatisticsComparison comparison = new StatisticsComparison(before, after);

        assertThat(comparison.resolutionIncrease()).isEqualTo(4.0);
        assertThat(comparison.widthDelta()).isEqualTo(100);
        assertThat(comparison.heightDelta()).isEqualTo(50);
        assertThat(comparison.brightnessDelta()).isCloseTo(10.5, within(1e-9));
        assertThat(comparison.sharpnessDelta()).isCloseTo(18.0, within(1e-9));
        assertThat(comparison.sizeDeltaMegabytes())
                .isCloseTo((200 * 100 * 3 - 100 * 50 * 3) / (1024.0 * 1024.0), within(1e-12));
    }

    @Test
    void shouldRenderRowsAndSummary() {
        StatisticsComparison comparison = new StatisticsComparison(before, after);

        assertThat(comparison.rows())
                .extracting(StatisticsComparison.Row::metric)
                .containsExactly("Width", "Height", "Total Pixels", "File Size (MB)", "Mean Brightness",
                        "Brightness Std", "Sharpness", "Entropy");
        assertThat(comparison.rows().get(2)).isEqualTo(new StatisticsComparison.Row("Total Pixels", "5000", "20000"));
        assertThat(comparison.rows().get(4).enhanced()).isEqualTo("130.5");
        assertThat(comparison.summary()).isEqualTo("4.0x resolution increase with 200×100 final dimensions");
    }

    @Test
    void recordRejectsMismatchedChannelLists() {
        assertThatThrownBy(() -> new StatisticsRecord(1, 1, 3, List.of(0.0), List.of(0.0), 0, 0, 0, 0, 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static StatisticsRecord record(int width, int height, double meanBrightness, double std, double sharpness) {
        return new StatisticsRecord(width, height, 3,
                List.of(meanBrightness, meanBrightness, meanBrightness),
                List.of(std, std, std),
                0.0, 255.0, meanBrightness, std, sharpness, 6.5);
    }
}
