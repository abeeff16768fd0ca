package com.autoviral.worker.dto;

import com.autoviral.common.enums.EpisodeStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 시리즈 JSON 설정 컬럼의 타입 표현
 */
public class SeriesDto {

    /**
     * 게시 일정
     * customDays: 0=월요일 ... 6=일요일
     */
    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Schedule {
        private String frequency;       // daily, weekly (그 외 값은 daily 취급)
        private String publishTime;     // HH:MM[:SS]
        private String timezone;        // IANA 이름
        private String startDate;
        private List<Integer> customDays;
        private Boolean active;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ScriptPreferences {
        private String storyLength;     // 30_40, 45_60
        private String tone;
        private String hookStrength;
        private boolean includeCta;
        private String ctaText;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CustomTopic {
        private String topicTitle;
        private String targetAudience;
        private String tone;
        private List<String> keywords;
        private String ctaStyle;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class VoiceLanguage {
        private String languageCode;
        private String gender;
        private String style;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MusicSettings {
        private String customUploadAssetId;
        private String libraryTrackId;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ArtStyle {
        private String style;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class VisualEffect {
        private String effectId;
        private boolean enabled;
        @JsonProperty("isPremium")
        private boolean premium;
    }

    /**
     * 파싱된 시리즈 설정 (캐시 대상)
     * 없는 항목은 null 이 아니라 빈 객체/목록으로 채운다. 단 scriptPreferences, voiceLanguage 는
     * 시작 조건 검사에 쓰이므로 원본이 비어 있으면 null 로 둔다.
     */
    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Config {
        private Long seriesId;
        private Long workspaceId;
        private String contentType;
        private CustomTopic customTopic;
        private ScriptPreferences scriptPreferences;
        private VoiceLanguage voiceLanguage;
        private MusicSettings musicSettings;
        private ArtStyle artStyle;
        private List<VisualEffect> visualEffects;
        private Schedule schedule;
        private List<Long> connectedSocialAccountIds;
        private boolean autoPostEnabled;

        public String getLanguageCode() {
            if (voiceLanguage == null || voiceLanguage.getLanguageCode() == null
                    || voiceLanguage.getLanguageCode().isBlank()) {
                return "en-US";
            }
            return voiceLanguage.getLanguageCode();
        }
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CreditEstimate {
        private double perEpisode;
        private double estimatedMonthly;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UpcomingEpisode {
        private Long episodeId;
        private Integer sequenceNumber;
        private LocalDateTime scheduledAt;
        private EpisodeStatus status;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LaunchResult {
        private Long seriesId;
        private List<UpcomingEpisode> upcomingEpisodes;
        private CreditEstimate creditEstimate;
        private boolean autoPostEnabled;
    }
}
