package com.autoviral.worker.service.media;

import com.autoviral.common.enums.AssetSource;
import com.autoviral.common.enums.AssetType;
import com.autoviral.common.enums.EpisodeStatus;
import com.autoviral.common.enums.PipelineStage;
import com.autoviral.common.exception.ApiException;
import com.autoviral.common.exception.ErrorCode;
import com.autoviral.worker.config.PipelineConfig;
import com.autoviral.worker.dto.MediaManifest;
import com.autoviral.worker.dto.ScriptDto;
import com.autoviral.worker.dto.SeriesDto;
import com.autoviral.worker.entity.Asset;
import com.autoviral.worker.entity.Episode;
import com.autoviral.worker.entity.Script;
import com.autoviral.worker.mapper.AssetMapper;
import com.autoviral.worker.mapper.ScriptMapper;
import com.autoviral.worker.service.episode.EpisodeLease;
import com.autoviral.worker.service.episode.EpisodeUpdateService;
import com.autoviral.worker.service.episode.StaleLeaseException;
import com.autoviral.worker.service.image.ImageGeneratorService;
import com.autoviral.worker.service.pipeline.StageHandler;
import com.autoviral.worker.service.pipeline.StageOutcome;
import com.autoviral.worker.service.series.SeriesConfigService;
import com.autoviral.worker.service.storage.StorageKeys;
import com.autoviral.worker.service.storage.StorageService;
import com.autoviral.worker.service.tts.OpenAiVoice;
import com.autoviral.worker.service.tts.TtsService;
import com.autoviral.worker.service.video.FfmpegService;
import com.autoviral.worker.util.Jsons;
import com.autoviral.worker.util.WorkDirectory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 미디어 단계 (입력: episodeId, 산출물: episode.media_manifest)
 *
 * 씬 모드: 씬마다 TTS → 길이 측정 → 이미지(실패해도 진행) → 에셋 저장
 * 레거시 모드: 대본 전체 나레이션 한 개 + 커버 이미지 한 장
 * 두 모드 모두 자막 에셋과 배경음악 참조를 매니페스트에 담는다. 오디오 실패는 단계 실패.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MediaStage implements StageHandler {

    static final double DEFAULT_SCENE_SECONDS = 5.0;
    static final int CAPTION_TEXT_MAX = 2000;

    private final EpisodeUpdateService episodeUpdateService;
    private final SeriesConfigService seriesConfigService;
    private final ScriptMapper scriptMapper;
    private final AssetMapper assetMapper;
    private final TtsService ttsService;
    private final ImageGeneratorService imageGeneratorService;
    private final FfmpegService ffmpegService;
    private final StorageService storageService;
    private final PipelineConfig pipelineConfig;
    private final ObjectMapper objectMapper;

    @Override
    public PipelineStage getStage() {
        return PipelineStage.MEDIA;
    }

    @Override
    public StageOutcome execute(Long episodeId, LocalDateTime leaseUntil) {
        Episode episode = episodeUpdateService.getEpisode(episodeId);
        if (isAlreadySynthesized(episode)) {
            // 매니페스트 저장 후 RENDER 등록 전에 작업이 재전달된 경우
            log.info("[Media] episodeId={} manifest already saved, re-chaining", episodeId);
            return StageOutcome.COMPLETED;
        }
        if (!episode.getStatus().canStartMedia()) {
            log.info("[Media] episodeId={} skipped, status={}", episodeId, episode.getStatus());
            return StageOutcome.SKIPPED;
        }

        EpisodeLease lease = episodeUpdateService.acquire(episode, PipelineStage.MEDIA, leaseUntil);
        try (WorkDirectory workDir = WorkDirectory.create("media-" + episodeId)) {
            episodeUpdateService.startMedia(lease);
            SeriesDto.Config config = seriesConfigService.getConfig(episode.getSeriesId());
            Script script = loadScript(episode);
            OpenAiVoice voice = OpenAiVoice.select(config.getVoiceLanguage());
            List<ScriptDto.SceneSpec> scenes = parseScenes(script.getScenes());

            MediaManifest manifest = pipelineConfig.isSceneBasedVideo() && !scenes.isEmpty()
                    ? synthesizeScenes(episode, config, script, scenes, voice, workDir)
                    : synthesizeSingle(episode, config, script, voice);

            episodeUpdateService.saveManifest(lease, Jsons.write(objectMapper, manifest));
            log.info("[Media] episodeId={} manifest ready, sceneMode={} scenes={}", episodeId,
                    manifest.isSceneMode(), manifest.isSceneMode() ? manifest.getScenes().size() : 0);
            return StageOutcome.COMPLETED;
        } catch (StaleLeaseException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("[Media] episodeId={} failed: {}", episodeId, e.getMessage());
            episodeUpdateService.markFailed(lease, e.getMessage(), null);
            throw e;
        }
    }

    static boolean isAlreadySynthesized(Episode episode) {
        return episode.getStatus() == EpisodeStatus.GENERATING
                && episode.getCurrentStage() == PipelineStage.MEDIA
                && episode.getMediaManifest() != null
                && episode.getLeaseToken() == null;
    }

    private MediaManifest synthesizeScenes(Episode episode, SeriesDto.Config config, Script script,
                                           List<ScriptDto.SceneSpec> scenes, OpenAiVoice voice, WorkDirectory workDir) {
        Long workspaceId = config.getWorkspaceId();
        Long episodeId = episode.getEpisodeId();
        List<MediaManifest.SceneRef> refs = new ArrayList<>();

        for (int idx = 0; idx < scenes.size(); idx++) {
            ScriptDto.SceneSpec scene = scenes.get(idx);
            String text = scene.getText() == null ? "" : scene.getText().trim();
            if (text.isEmpty()) {
                throw new ApiException(ErrorCode.SCRIPT_SCENES_CORRUPTED, "Scene " + (idx + 1) + " has no text");
            }

            byte[] audio = ttsService.synthesize(text, voice);
            Path voiceFile = workDir.write("scene_" + idx + "_voice.mp3", audio);
            double duration = ffmpegService.probeDuration(voiceFile, DEFAULT_SCENE_SECONDS);
            String voiceUrl = storageService.upload(StorageKeys.sceneVoice(workspaceId, episodeId, idx), audio, "audio/mpeg");
            Asset voiceAsset = insertAsset(workspaceId, AssetType.AUDIO, voiceUrl, "audio/mpeg", duration,
                    metadata(episodeId, "scene_voice", idx));

            Long imageAssetId = null;
            String visual = scene.getVisualDescription() != null && !scene.getVisualDescription().isBlank()
                    ? scene.getVisualDescription() : text;
            Optional<byte[]> image = imageGeneratorService.generateSceneImage(visual, idx);
            if (image.isPresent()) {
                String imageUrl = storageService.upload(StorageKeys.sceneImage(workspaceId, episodeId, idx), image.get(), "image/png");
                imageAssetId = insertAsset(workspaceId, AssetType.IMAGE, imageUrl, "image/png", null,
                        metadata(episodeId, "scene_cover", idx)).getAssetId();
            }

            refs.add(MediaManifest.SceneRef.builder()
                    .voiceAssetId(voiceAsset.getAssetId())
                    .imageAssetId(imageAssetId)
                    .durationSeconds(duration)
                    .build());
            log.debug("[Media] episodeId={} scene {} duration={}s image={}", episodeId, idx, duration, imageAssetId != null);
        }

        return MediaManifest.builder()
                .scenes(refs)
                .captionAssetId(insertCaption(workspaceId, episodeId, script.getText()))
                .musicAssetId(resolveMusic(config))
                .build();
    }

    private MediaManifest synthesizeSingle(Episode episode, SeriesDto.Config config, Script script, OpenAiVoice voice) {
        Long workspaceId = config.getWorkspaceId();
        Long episodeId = episode.getEpisodeId();

        byte[] audio = ttsService.synthesize(script.getText(), voice);
        String voiceUrl = storageService.upload(StorageKeys.voice(workspaceId, episodeId), audio, "audio/mpeg");
        Asset voiceAsset = insertAsset(workspaceId, AssetType.AUDIO, voiceUrl, "audio/mpeg", null,
                metadata(episodeId, "voice", null));

        Long musicAssetId = resolveMusic(config);
        Long captionAssetId = insertCaption(workspaceId, episodeId, script.getText());

        Long imageAssetId = null;
        Optional<byte[]> image = imageGeneratorService.generateCoverImage(script.getText());
        if (image.isPresent()) {
            String imageUrl = storageService.upload(StorageKeys.cover(workspaceId, episodeId), image.get(), "image/png");
            imageAssetId = insertAsset(workspaceId, AssetType.IMAGE, imageUrl, "image/png", null,
                    metadata(episodeId, "video_cover", null)).getAssetId();
        }

        return MediaManifest.builder()
                .voiceAssetId(voiceAsset.getAssetId())
                .musicAssetId(musicAssetId)
                .captionAssetId(captionAssetId)
                .imageAssetId(imageAssetId)
                .build();
    }

    /**
     * 자막 에셋: 아직 파일은 없고(url "") 대본 텍스트만 메타데이터에 담는다
     */
    private Long insertCaption(Long workspaceId, Long episodeId, String scriptText) {
        Map<String, Object> meta = metadata(episodeId, null, null);
        String text = scriptText == null ? "" : scriptText;
        meta.put("text", text.length() > CAPTION_TEXT_MAX ? text.substring(0, CAPTION_TEXT_MAX) : text);
        return insertAsset(workspaceId, AssetType.CAPTION_FILE, "", "srt", null, meta).getAssetId();
    }

    /**
     * 직접 업로드 음악 → 라이브러리 트랙 순. 같은 워크스페이스의 MUSIC 에셋만 인정.
     */
    Long resolveMusic(SeriesDto.Config config) {
        SeriesDto.MusicSettings settings = config.getMusicSettings();
        if (settings == null) {
            return null;
        }
        for (String candidate : new String[]{settings.getCustomUploadAssetId(), settings.getLibraryTrackId()}) {
            Long assetId = parseId(candidate);
            if (assetId == null) {
                continue;
            }
            Optional<Asset> asset = assetMapper.findById(assetId)
                    .filter(a -> config.getWorkspaceId().equals(a.getWorkspaceId()))
                    .filter(a -> a.getType() == AssetType.MUSIC);
            if (asset.isPresent()) {
                return asset.get().getAssetId();
            }
            log.debug("[Media] music asset {} not usable for workspace {}", assetId, config.getWorkspaceId());
        }
        return null;
    }

    private Script loadScript(Episode episode) {
        if (episode.getScriptId() == null) {
            throw new ApiException(ErrorCode.SCRIPT_NOT_FOUND, "Episode has no script text");
        }
        Script script = scriptMapper.findById(episode.getScriptId())
                .orElseThrow(() -> new ApiException(ErrorCode.SCRIPT_NOT_FOUND, "Script " + episode.getScriptId() + " not found"));
        if (script.getText() == null || script.getText().isBlank()) {
            throw new ApiException(ErrorCode.SCRIPT_NOT_FOUND, "Episode has no script text");
        }
        return script;
    }

    private List<ScriptDto.SceneSpec> parseScenes(String scenesJson) {
        if (scenesJson == null || scenesJson.isBlank()) {
            return List.of();
        }
        try {
            List<ScriptDto.SceneSpec> scenes = objectMapper.readValue(scenesJson, new TypeReference<List<ScriptDto.SceneSpec>>() {});
            return scenes != null ? scenes : List.of();
        } catch (JsonProcessingException e) {
            throw new ApiException(ErrorCode.SCRIPT_SCENES_CORRUPTED, "Stored script scenes are malformed", e);
        }
    }

    private Asset insertAsset(Long workspaceId, AssetType type, String url, String format,
                              Double durationSeconds, Map<String, Object> metadata) {
        Asset asset = Asset.builder()
                .workspaceId(workspaceId)
                .type(type)
                .source(AssetSource.GENERATED)
                .url(url)
                .format(format)
                .durationSeconds(durationSeconds)
                .metadata(Jsons.write(objectMapper, metadata))
                .build();
        assetMapper.insert(asset);
        return asset;
    }

    private static Map<String, Object> metadata(Long episodeId, String role, Integer sceneIndex) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("episode_id", String.valueOf(episodeId));
        if (role != null) {
            meta.put("role", role);
        }
        if (sceneIndex != null) {
            meta.put("scene_index", sceneIndex);
        }
        return meta;
    }

    private static Long parseId(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Long.valueOf(value.trim());
        } catch (NumberFormatException e) {
            log.debug("[Media] ignoring non-numeric music asset id '{}'", value);
            return null;
        }
    }
}
