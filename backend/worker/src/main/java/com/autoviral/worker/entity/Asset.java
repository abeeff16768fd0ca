package com.autoviral.worker.entity;

import com.autoviral.common.enums.AssetSource;
import com.autoviral.common.enums.AssetType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Asset {
    private Long assetId;
    private Long workspaceId;
    private AssetType type;
    private AssetSource source;
    private String url;
    private String format;
    private Double durationSeconds;
    private String metadata;        // JSON (role, scene_index, episode_id ...)
    private LocalDateTime createdAt;
}
