package com.autoviral.worker.entity;

import com.autoviral.common.enums.EpisodeStatus;
import com.autoviral.common.enums.PipelineStage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Episode {
    private Long episodeId;
    private Long seriesId;
    private Integer sequenceNumber;
    private LocalDateTime scheduledAt;   // UTC
    private EpisodeStatus status;
    private Long scriptId;
    private Long videoAssetId;
    private String previewUrl;
    private String errorPayload;         // JSON {step, message, ...}
    private String mediaManifest;        // JSON, 미디어 단계 → 렌더 단계 전달용
    private Double creditsUsed;

    // 단계 점유(lease)
    private PipelineStage currentStage;
    private String leaseToken;
    private LocalDateTime leaseExpiresAt;
    private Long version;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
