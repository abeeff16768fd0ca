package com.autoviral.worker.entity;

import com.autoviral.common.enums.SeriesStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 시리즈 (반복 콘텐츠 설정)
 * JSON 컬럼은 문자열로 읽고 SeriesConfigService 에서 파싱한다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Series {
    private Long seriesId;
    private Long workspaceId;
    private String name;
    private String contentType;               // motivation, horror, finance, ai_tech, kids, anime, custom
    private String customTopic;               // JSON
    private String scriptPreferences;         // JSON
    private String voiceLanguage;             // JSON
    private String musicSettings;             // JSON
    private String artStyle;                  // JSON {style}
    private String captionStyle;              // JSON
    private String visualEffects;             // JSON
    private String schedule;                  // JSON
    private String connectedSocialAccountIds; // JSON 배열
    private SeriesStatus status;
    private Double estimatedCreditsPerVideo;
    private Boolean autoPostEnabled;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
