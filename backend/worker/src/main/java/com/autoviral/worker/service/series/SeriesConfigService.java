package com.autoviral.worker.service.series;

import com.autoviral.common.exception.ApiException;
import com.autoviral.common.exception.ErrorCode;
import com.autoviral.worker.dto.SeriesDto;
import com.autoviral.worker.entity.Series;
import com.autoviral.worker.mapper.SeriesMapper;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 시리즈 JSON 설정 파싱 + 캐시
 * 캐시 키에 updatedAt 을 포함해서 설정이 바뀌면 자연히 새로 파싱된다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SeriesConfigService {

    private final SeriesMapper seriesMapper;
    private final ObjectMapper objectMapper;

    private Cache<String, SeriesDto.Config> configCache;

    @PostConstruct
    public void initCache() {
        this.configCache = Caffeine.newBuilder()
                .expireAfterWrite(10, TimeUnit.MINUTES)
                .maximumSize(1000)
                .build();
        log.info("SeriesConfigService 캐시 초기화 완료 (TTL: 10분)");
    }

    public Series getSeries(Long seriesId) {
        return seriesMapper.findById(seriesId)
                .orElseThrow(() -> new ApiException(ErrorCode.SERIES_NOT_FOUND, "Series " + seriesId + " not found"));
    }

    public SeriesDto.Config getConfig(Long seriesId) {
        return getConfig(getSeries(seriesId));
    }

    public SeriesDto.Config getConfig(Series series) {
        String key = series.getSeriesId() + ":" + series.getUpdatedAt();
        return configCache.get(key, k -> parse(series));
    }

    SeriesDto.Config parse(Series series) {
        return SeriesDto.Config.builder()
                .seriesId(series.getSeriesId())
                .workspaceId(series.getWorkspaceId())
                .contentType(series.getContentType())
                .customTopic(read(series.getCustomTopic(), SeriesDto.CustomTopic.class))
                .scriptPreferences(read(series.getScriptPreferences(), SeriesDto.ScriptPreferences.class))
                .voiceLanguage(read(series.getVoiceLanguage(), SeriesDto.VoiceLanguage.class))
                .musicSettings(orDefault(read(series.getMusicSettings(), SeriesDto.MusicSettings.class),
                        new SeriesDto.MusicSettings()))
                .artStyle(orDefault(read(series.getArtStyle(), SeriesDto.ArtStyle.class), new SeriesDto.ArtStyle()))
                .visualEffects(readList(series.getVisualEffects(), new TypeReference<List<SeriesDto.VisualEffect>>() {}))
                .schedule(orDefault(read(series.getSchedule(), SeriesDto.Schedule.class), new SeriesDto.Schedule()))
                .connectedSocialAccountIds(readList(series.getConnectedSocialAccountIds(),
                        new TypeReference<List<Long>>() {}))
                .autoPostEnabled(Boolean.TRUE.equals(series.getAutoPostEnabled()))
                .build();
    }

    private <T> T read(String json, Class<T> type) {
        if (json == null || json.isBlank() || "{}".equals(json.trim())) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new ApiException(ErrorCode.SERIES_INCOMPLETE,
                    "Invalid " + type.getSimpleName() + " configuration: " + e.getOriginalMessage());
        }
    }

    private <T> List<T> readList(String json, TypeReference<List<T>> type) {
        if (json == null || json.isBlank()) {
            return Collections.emptyList();
        }
        try {
            List<T> list = objectMapper.readValue(json, type);
            return list == null ? Collections.emptyList() : new ArrayList<>(list);
        } catch (JsonProcessingException e) {
            throw new ApiException(ErrorCode.SERIES_INCOMPLETE, "Invalid list configuration: " + e.getOriginalMessage());
        }
    }

    private static <T> T orDefault(T value, T fallback) {
        return value != null ? value : fallback;
    }
}
