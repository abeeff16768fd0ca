package com.autoviral.worker.service.script;

import com.autoviral.common.enums.EpisodeStatus;
import com.autoviral.common.enums.PipelineStage;
import com.autoviral.worker.config.PipelineConfig;
import com.autoviral.worker.dto.ScriptDto;
import com.autoviral.worker.dto.SeriesDto;
import com.autoviral.worker.entity.Episode;
import com.autoviral.worker.entity.Script;
import com.autoviral.worker.entity.Series;
import com.autoviral.worker.mapper.ScriptMapper;
import com.autoviral.worker.service.episode.EpisodeLease;
import com.autoviral.worker.service.episode.EpisodeUpdateService;
import com.autoviral.worker.service.episode.StaleLeaseException;
import com.autoviral.worker.service.pipeline.StageHandler;
import com.autoviral.worker.service.pipeline.StageOutcome;
import com.autoviral.worker.service.series.SeriesConfigService;
import com.autoviral.worker.util.Jsons;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 대본 단계 (입력: episodeId)
 *
 * SCHEDULED/FAILED → GENERATING → READY_FOR_REVIEW, 실패 시 FAILED {step: script_generation}.
 * 같은 작업이 재전달되어 GENERATING(SCRIPT) 상태로 남아 있으면 이어서 실행한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScriptStage implements StageHandler {

    private final EpisodeUpdateService episodeUpdateService;
    private final SeriesConfigService seriesConfigService;
    private final ScriptGeneratorService scriptGeneratorService;
    private final ScriptMapper scriptMapper;
    private final PipelineConfig pipelineConfig;
    private final ObjectMapper objectMapper;

    @Override
    public PipelineStage getStage() {
        return PipelineStage.SCRIPT;
    }

    @Override
    public StageOutcome execute(Long episodeId, LocalDateTime leaseUntil) {
        Episode episode = episodeUpdateService.getEpisode(episodeId);
        if (isAlreadyScripted(episode)) {
            // 대본은 저장됐지만 후속 단계 등록 전에 작업이 재전달된 경우. 완료로 돌려 MEDIA 를 다시 잇는다.
            log.info("[Script] episodeId={} already has scriptId={}, re-chaining", episodeId, episode.getScriptId());
            return StageOutcome.COMPLETED;
        }
        if (!canRun(episode)) {
            log.info("[Script] episodeId={} skipped, status={}", episodeId, episode.getStatus());
            return StageOutcome.SKIPPED;
        }

        EpisodeLease lease = episodeUpdateService.acquire(episode, PipelineStage.SCRIPT, leaseUntil);
        try {
            episodeUpdateService.markGenerating(lease);
            Series series = seriesConfigService.getSeries(episode.getSeriesId());
            SeriesDto.Config config = seriesConfigService.getConfig(series);

            ScriptDto.Generated generated = pipelineConfig.isSceneBasedVideo()
                    ? scriptGeneratorService.generateScenes(config, pipelineConfig.getSceneMin(), pipelineConfig.getSceneMax())
                    : scriptGeneratorService.generateText(config);

            Script script = Script.builder()
                    .seriesId(series.getSeriesId())
                    .languageCode(config.getLanguageCode())
                    .text(generated.getText())
                    .scenes(Jsons.write(objectMapper, generated.getScenes()))
                    .promptMetadata(Jsons.write(objectMapper, promptMetadata(config)))
                    .build();
            scriptMapper.insert(script);

            episodeUpdateService.markScriptReady(lease, script.getScriptId());
            log.info("[Script] episodeId={} scriptId={} length={} scenes={}", episodeId, script.getScriptId(),
                    generated.getText().length(), generated.getScenes() != null ? generated.getScenes().size() : 0);
            return StageOutcome.COMPLETED;
        } catch (StaleLeaseException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("[Script] episodeId={} failed: {}", episodeId, e.getMessage());
            episodeUpdateService.markFailed(lease, e.getMessage(), null);
            throw e;
        }
    }

    static boolean canRun(Episode episode) {
        EpisodeStatus status = episode.getStatus();
        return status.canStartScript()
                || (status == EpisodeStatus.GENERATING && episode.getCurrentStage() == PipelineStage.SCRIPT);
    }

    /**
     * 마지막으로 끝난 단계가 SCRIPT 이고 결과가 검토 대기 중이며 점유가 풀려 있음
     */
    static boolean isAlreadyScripted(Episode episode) {
        return episode.getStatus() == EpisodeStatus.READY_FOR_REVIEW
                && episode.getCurrentStage() == PipelineStage.SCRIPT
                && episode.getScriptId() != null
                && episode.getLeaseToken() == null;
    }

    private Map<String, Object> promptMetadata(SeriesDto.Config config) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("content_type", config.getContentType());
        metadata.put("custom_topic", config.getCustomTopic());
        metadata.put("script_preferences", config.getScriptPreferences());
        return metadata;
    }
}
