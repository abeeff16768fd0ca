package com.autoviral.worker.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 미디어 단계가 만들고 렌더 단계가 소비하는 에셋 참조 목록 (episode.media_manifest)
 *
 * 씬 모드:   {scenes:[{image_asset_id, voice_asset_id, duration_seconds}], caption_asset_id, music_asset_id}
 * 레거시 모드: {voice_asset_id, music_asset_id, caption_asset_id, image_asset_id}
 * 에셋 ID 는 문자열로 직렬화한다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MediaManifest {

    @JsonProperty("scenes")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private List<SceneRef> scenes;

    @JsonProperty("caption_asset_id")
    @JsonSerialize(using = ToStringSerializer.class)
    private Long captionAssetId;

    @JsonProperty("music_asset_id")
    @JsonSerialize(using = ToStringSerializer.class)
    private Long musicAssetId;

    // 레거시 모드 전용
    @JsonProperty("voice_asset_id")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonSerialize(using = ToStringSerializer.class)
    private Long voiceAssetId;

    // 레거시 모드에서는 커버가 없어도 null 로 기록, 씬 모드에서는 키를 쓰지 않는다
    @JsonIgnore
    private Long imageAssetId;

    @JsonIgnore
    public boolean isSceneMode() {
        return scenes != null && !scenes.isEmpty();
    }

    @JsonAnyGetter
    public Map<String, Object> legacyImageField() {
        if (isSceneMode()) {
            return Map.of();
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("image_asset_id", imageAssetId != null ? imageAssetId.toString() : null);
        return fields;
    }

    @JsonSetter("image_asset_id")
    private void readImageAssetId(Long imageAssetId) {
        this.imageAssetId = imageAssetId;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SceneRef {
        @JsonProperty("image_asset_id")
        @JsonSerialize(using = ToStringSerializer.class)
        private Long imageAssetId;

        @JsonProperty("voice_asset_id")
        @JsonSerialize(using = ToStringSerializer.class)
        private Long voiceAssetId;

        @JsonProperty("duration_seconds")
        private double durationSeconds;
    }
}
