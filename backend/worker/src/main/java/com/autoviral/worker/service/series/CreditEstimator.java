package com.autoviral.worker.service.series;

import com.autoviral.worker.dto.SeriesDto;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * 에피소드당 예상 크레딧
 * 기본 10, 45~60초 +5, 화풍 가중치, 활성 프리미엄 효과당 +5
 */
@Component
public class CreditEstimator {

    private static final double BASE = 10.0;
    private static final Set<String> HEAVY_STYLES = Set.of("cinematic_ai", "anime");
    private static final Set<String> MEDIUM_STYLES = Set.of("realistic", "cartoon", "comic");

    public double perEpisode(SeriesDto.Config config) {
        double credits = BASE;

        SeriesDto.ScriptPreferences prefs = config.getScriptPreferences();
        if (prefs != null && "45_60".equals(prefs.getStoryLength())) {
            credits += 5.0;
        }

        String style = config.getArtStyle() != null ? config.getArtStyle().getStyle() : null;
        if (style != null && HEAVY_STYLES.contains(style)) {
            credits += 8.0;
        } else if (style != null && MEDIUM_STYLES.contains(style)) {
            credits += 4.0;
        }

        if (config.getVisualEffects() != null) {
            long premium = config.getVisualEffects().stream()
                    .filter(e -> e.isEnabled() && e.isPremium())
                    .count();
            credits += premium * 5.0;
        }
        return Math.round(credits * 10.0) / 10.0;
    }

    /**
     * 월 예상치: daily 는 주 7회 기준, 그 외 12회
     */
    public SeriesDto.CreditEstimate estimate(SeriesDto.Config config) {
        double per = perEpisode(config);
        String frequency = config.getSchedule() != null ? config.getSchedule().getFrequency() : null;
        int multiplier = (frequency == null || "daily".equals(frequency)) ? 7 : 12;
        return SeriesDto.CreditEstimate.builder()
                .perEpisode(per)
                .estimatedMonthly(Math.round(per * multiplier * 10.0) / 10.0)
                .build();
    }
}
