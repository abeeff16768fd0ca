package com.autoviral.worker.service.series;

import com.autoviral.worker.dto.SeriesDto;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CreditEstimator Tests")
class CreditEstimatorTest {

    private final CreditEstimator estimator = new CreditEstimator();

    @ParameterizedTest
    @CsvSource({
            "30_40, , 10.0",
            "45_60, , 15.0",
            "30_40, anime, 18.0",
            "45_60, cinematic_ai, 23.0",
            "30_40, comic, 14.0",
            "30_40, watercolor, 10.0"
    })
    @DisplayName("Should add length and art style weights to the base")
    void testPerEpisode(String storyLength, String style, double expected) {
        SeriesDto.Config config = SeriesDto.Config.builder()
                .scriptPreferences(SeriesDto.ScriptPreferences.builder().storyLength(storyLength).build())
                .artStyle(style != null ? SeriesDto.ArtStyle.builder().style(style).build() : null)
                .build();

        assertEquals(expected, estimator.perEpisode(config));
    }

    @Test
    @DisplayName("Only enabled premium effects cost extra")
    void testPerEpisode_PremiumEffects() {
        SeriesDto.Config config = SeriesDto.Config.builder()
                .visualEffects(List.of(
                        new SeriesDto.VisualEffect("glitch", true, true),
                        new SeriesDto.VisualEffect("grain", true, false),
                        new SeriesDto.VisualEffect("bokeh", false, true),
                        new SeriesDto.VisualEffect("flare", true, true)))
                .build();

        assertEquals(20.0, estimator.perEpisode(config));
    }

    @Test
    @DisplayName("Monthly estimate multiplies by 7 for daily and 12 otherwise")
    void testEstimate() {
        SeriesDto.Config daily = SeriesDto.Config.builder()
                .schedule(SeriesDto.Schedule.builder().frequency("daily").build())
                .build();
        SeriesDto.Config weekly = SeriesDto.Config.builder()
                .schedule(SeriesDto.Schedule.builder().frequency("weekly").build())
                .build();

        assertEquals(70.0, estimator.estimate(daily).getEstimatedMonthly());
        assertEquals(120.0, estimator.estimate(weekly).getEstimatedMonthly());
        assertEquals(10.0, estimator.estimate(SeriesDto.Config.builder().build()).getPerEpisode());
    }
}
