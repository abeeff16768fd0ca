package com.autoviral.worker.service.video;

import com.autoviral.common.enums.AssetSource;
import com.autoviral.common.enums.AssetType;
import com.autoviral.common.enums.EpisodeStatus;
import com.autoviral.common.enums.PipelineStage;
import com.autoviral.common.exception.ApiException;
import com.autoviral.common.exception.ErrorCode;
import com.autoviral.worker.dto.MediaManifest;
import com.autoviral.worker.entity.Asset;
import com.autoviral.worker.entity.Episode;
import com.autoviral.worker.mapper.AssetMapper;
import com.autoviral.worker.service.episode.EpisodeLease;
import com.autoviral.worker.service.episode.EpisodeUpdateService;
import com.autoviral.worker.service.episode.StaleLeaseException;
import com.autoviral.worker.service.pipeline.StageHandler;
import com.autoviral.worker.service.pipeline.StageOutcome;
import com.autoviral.worker.service.storage.StorageKeys;
import com.autoviral.worker.service.storage.StorageService;
import com.autoviral.worker.util.Jsons;
import com.autoviral.worker.util.WorkDirectory;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 렌더 단계 (입력: episodeId + media_manifest, 산출물: VIDEO 에셋)
 *
 * 성공 시 videoAssetId/previewUrl 설정, READY_FOR_REVIEW, 오류와 매니페스트 비움.
 * 실패 시 기존 오류 payload 에 {step: render, message} 를 덮어써 FAILED.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VideoAssemblyStage implements StageHandler {

    static final double DEFAULT_SINGLE_VOICE_SECONDS = 30.0;
    static final double DEFAULT_SCENE_SECONDS = 5.0;

    private final EpisodeUpdateService episodeUpdateService;
    private final AssetMapper assetMapper;
    private final FfmpegService ffmpegService;
    private final StorageService storageService;
    private final ObjectMapper objectMapper;

    @Override
    public PipelineStage getStage() {
        return PipelineStage.RENDER;
    }

    @Override
    public StageOutcome execute(Long episodeId, LocalDateTime leaseUntil) {
        Episode episode = episodeUpdateService.getEpisode(episodeId);
        EpisodeStatus status = episode.getStatus();
        if (isAlreadyRendered(episode)) {
            // 영상 저장 후 자동 게시 전에 작업이 재전달된 경우. 완료로 돌려 게시 트리거를 다시 탄다.
            log.info("[Render] episodeId={} already has videoAssetId={}, re-chaining", episodeId, episode.getVideoAssetId());
            return StageOutcome.COMPLETED;
        }
        if (status != EpisodeStatus.GENERATING && status != EpisodeStatus.FAILED) {
            log.info("[Render] episodeId={} skipped, status={}", episodeId, status);
            return StageOutcome.SKIPPED;
        }

        EpisodeLease lease = episodeUpdateService.acquire(episode, PipelineStage.RENDER, leaseUntil);
        if (status == EpisodeStatus.FAILED) {
            episodeUpdateService.markGenerating(lease);
        }
        try (WorkDirectory workDir = WorkDirectory.create("render-" + episodeId)) {
            MediaManifest manifest = Jsons.read(objectMapper, episode.getMediaManifest(), MediaManifest.class,
                    ErrorCode.MEDIA_MANIFEST_MISSING);
            if (manifest == null) {
                throw new ApiException(ErrorCode.MEDIA_MANIFEST_MISSING, "No media assets; run media generation first");
            }

            Path output = workDir.resolve("out.mp4");
            Rendered rendered = manifest.isSceneMode()
                    ? renderScenes(manifest.getScenes(), workDir, output)
                    : renderSingle(manifest, workDir, output);

            String videoUrl = storageService.upload(StorageKeys.video(rendered.workspaceId, episodeId),
                    readAll(output), "video/mp4");
            Asset video = Asset.builder()
                    .workspaceId(rendered.workspaceId)
                    .type(AssetType.VIDEO)
                    .source(AssetSource.GENERATED)
                    .url(videoUrl)
                    .format("video/mp4")
                    .durationSeconds(rendered.durationSeconds)
                    .metadata(Jsons.write(objectMapper, Map.of("episode_id", String.valueOf(episodeId))))
                    .build();
            assetMapper.insert(video);

            episodeUpdateService.markRendered(lease, video.getAssetId(), videoUrl);
            log.info("[Render] episodeId={} videoAssetId={} duration={}s", episodeId, video.getAssetId(), rendered.durationSeconds);
            return StageOutcome.COMPLETED;
        } catch (StaleLeaseException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("[Render] episodeId={} failed: {}", episodeId, e.getMessage());
            episodeUpdateService.markFailed(lease, e.getMessage(), episode.getErrorPayload());
            throw e;
        }
    }

    static boolean isAlreadyRendered(Episode episode) {
        return episode.getStatus() == EpisodeStatus.READY_FOR_REVIEW
                && episode.getCurrentStage() == PipelineStage.RENDER
                && episode.getVideoAssetId() != null
                && episode.getLeaseToken() == null;
    }

    /**
     * 씬별 세그먼트 → concat. 총 길이는 매니페스트 길이의 합.
     */
    Rendered renderScenes(List<MediaManifest.SceneRef> scenes, WorkDirectory workDir, Path output) {
        Long workspaceId = null;
        double totalDuration = 0.0;
        List<Path> segments = new ArrayList<>();

        for (int idx = 0; idx < scenes.size(); idx++) {
            MediaManifest.SceneRef ref = scenes.get(idx);
            if (ref.getVoiceAssetId() == null) {
                throw new ApiException(ErrorCode.MEDIA_MANIFEST_MISSING, "Scene " + idx + " missing voice_asset_id");
            }
            Asset voiceAsset = findAsset(ref.getVoiceAssetId(), "Voice");
            if (workspaceId == null) {
                workspaceId = voiceAsset.getWorkspaceId();
            }
            Path voiceFile = workDir.write("scene_" + idx + "_voice.mp3", downloadVoice(voiceAsset, "for scene " + idx));
            double duration = ref.getDurationSeconds() > 0 ? ref.getDurationSeconds() : DEFAULT_SCENE_SECONDS;
            totalDuration += duration;

            Path imageFile = downloadImage(ref.getImageAssetId(), workspaceId, workDir, "scene_" + idx + ".png");
            Path segment = workDir.resolve(String.format("segment_%04d.mp4", idx));
            ffmpegService.renderSegment(imageFile, voiceFile, duration, segment);
            segments.add(segment);
        }
        ffmpegService.concat(segments, output);
        return new Rendered(workspaceId, totalDuration);
    }

    /**
     * 나레이션 한 개 + 커버 이미지 한 장을 세그먼트 하나로
     */
    Rendered renderSingle(MediaManifest manifest, WorkDirectory workDir, Path output) {
        if (manifest.getVoiceAssetId() == null) {
            throw new ApiException(ErrorCode.MEDIA_MANIFEST_MISSING, "Missing voice_asset_id in media");
        }
        Asset voiceAsset = findAsset(manifest.getVoiceAssetId(), "Voice");
        Long workspaceId = voiceAsset.getWorkspaceId();
        Path voiceFile = workDir.write("voice.mp3", downloadVoice(voiceAsset, null));
        double duration = ffmpegService.probeDuration(voiceFile, DEFAULT_SINGLE_VOICE_SECONDS);

        Path imageFile = downloadImage(manifest.getImageAssetId(), workspaceId, workDir, "cover.png");
        ffmpegService.renderSegment(imageFile, voiceFile, duration, output);
        return new Rendered(workspaceId, duration);
    }

    /**
     * 이미지가 없거나 다른 워크스페이스 것이면 null (검은 배경으로 렌더)
     */
    private Path downloadImage(Long imageAssetId, Long workspaceId, WorkDirectory workDir, String fileName) {
        if (imageAssetId == null) {
            return null;
        }
        return assetMapper.findById(imageAssetId)
                .filter(a -> a.getWorkspaceId() != null && a.getWorkspaceId().equals(workspaceId))
                .map(a -> storageService.download(a.getUrl()))
                .filter(data -> data.length > 0)
                .map(data -> workDir.write(fileName, data))
                .orElse(null);
    }

    /**
     * 나레이션은 필수. 비어 있으면 무음 세그먼트 대신 실패로 처리.
     */
    private byte[] downloadVoice(Asset voiceAsset, String context) {
        byte[] data = storageService.download(voiceAsset.getUrl());
        if (data == null || data.length == 0) {
            throw new ApiException(ErrorCode.STORAGE_FAILED,
                    "Could not download voice" + (context != null ? " " + context : "") + ": " + voiceAsset.getUrl());
        }
        return data;
    }

    private Asset findAsset(Long assetId, String label) {
        return assetMapper.findById(assetId)
                .orElseThrow(() -> new ApiException(ErrorCode.NOT_FOUND, label + " asset " + assetId + " not found"));
    }

    private static byte[] readAll(Path file) {
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new ApiException(ErrorCode.VIDEO_COMPOSITION_FAILED, "Failed to read rendered video", e);
        }
    }

    static final class Rendered {
        final Long workspaceId;
        final double durationSeconds;

        Rendered(Long workspaceId, double durationSeconds) {
            this.workspaceId = workspaceId;
            this.durationSeconds = durationSeconds;
        }
    }
}
