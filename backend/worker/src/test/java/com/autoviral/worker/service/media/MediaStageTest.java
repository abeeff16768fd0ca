package com.autoviral.worker.service.media;

import com.autoviral.common.enums.AssetType;
import com.autoviral.common.enums.EpisodeStatus;
import com.autoviral.common.enums.PipelineStage;
import com.autoviral.common.exception.ApiException;
import com.autoviral.common.exception.ErrorCode;
import com.autoviral.worker.config.HttpClientConfig;
import com.autoviral.worker.config.PipelineConfig;
import com.autoviral.worker.dto.MediaManifest;
import com.autoviral.worker.dto.SeriesDto;
import com.autoviral.worker.entity.Asset;
import com.autoviral.worker.entity.Episode;
import com.autoviral.worker.entity.Script;
import com.autoviral.worker.mapper.AssetMapper;
import com.autoviral.worker.mapper.ScriptMapper;
import com.autoviral.worker.service.ai.OpenAiClient;
import com.autoviral.worker.service.episode.EpisodeLease;
import com.autoviral.worker.service.episode.EpisodeUpdateService;
import com.autoviral.worker.service.image.ImageGeneratorService;
import com.autoviral.worker.service.image.ImagePromptBuilder;
import com.autoviral.worker.service.image.OpenAiImageGeneratorServiceImpl;
import com.autoviral.worker.service.image.SafetyFilterException;
import com.autoviral.worker.service.pipeline.StageOutcome;
import com.autoviral.worker.service.series.SeriesConfigService;
import com.autoviral.worker.service.storage.StorageService;
import com.autoviral.worker.service.tts.OpenAiVoice;
import com.autoviral.worker.service.tts.TtsService;
import com.autoviral.worker.service.video.FfmpegService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("MediaStage Tests")
class MediaStageTest {

    private static final LocalDateTime LEASE_UNTIL = LocalDateTime.of(2024, 3, 8, 12, 30);
    private static final String SCENES_JSON = "[{\"scene\":1,\"text\":\"Rain on glass.\",\"visual_description\":\"window\"},"
            + "{\"scene\":2,\"text\":\"A door creaks.\",\"visual_description\":\"hallway\"}]";

    private final ObjectMapper objectMapper = new HttpClientConfig().objectMapper();
    private EpisodeUpdateService episodeUpdateService;
    private SeriesConfigService seriesConfigService;
    private ScriptMapper scriptMapper;
    private AssetMapper assetMapper;
    private TtsService ttsService;
    private ImageGeneratorService imageGeneratorService;
    private FfmpegService ffmpegService;
    private StorageService storageService;
    private PipelineConfig pipelineConfig;
    private MediaStage stage;

    private final EpisodeLease lease = new EpisodeLease(7L, PipelineStage.MEDIA, "token");
    private final List<Asset> inserted = new ArrayList<>();

    @BeforeEach
    void setUp() {
        episodeUpdateService = mock(EpisodeUpdateService.class);
        seriesConfigService = mock(SeriesConfigService.class);
        scriptMapper = mock(ScriptMapper.class);
        assetMapper = mock(AssetMapper.class);
        ttsService = mock(TtsService.class);
        imageGeneratorService = mock(ImageGeneratorService.class);
        ffmpegService = mock(FfmpegService.class);
        storageService = mock(StorageService.class);
        pipelineConfig = mock(PipelineConfig.class);
        when(pipelineConfig.isSceneBasedVideo()).thenReturn(true);

        when(episodeUpdateService.getEpisode(7L)).thenReturn(Episode.builder()
                .episodeId(7L).seriesId(1L).scriptId(33L).status(EpisodeStatus.READY_FOR_REVIEW).version(2L).build());
        when(episodeUpdateService.acquire(any(), eq(PipelineStage.MEDIA), eq(LEASE_UNTIL))).thenReturn(lease);
        when(seriesConfigService.getConfig(1L)).thenReturn(SeriesDto.Config.builder()
                .seriesId(1L).workspaceId(10L)
                .voiceLanguage(SeriesDto.VoiceLanguage.builder().gender("male").style("deep").build())
                .build());
        when(ttsService.synthesize(anyString(), any())).thenReturn(new byte[]{1, 2, 3});
        when(storageService.upload(anyString(), any(), anyString()))
                .thenAnswer(invocation -> "https://bucket.s3.amazonaws.com/" + invocation.getArgument(0));

        AtomicLong ids = new AtomicLong();
        doAnswer(invocation -> {
            Asset asset = invocation.getArgument(0);
            ReflectionTestUtils.setField(asset, "assetId", ids.incrementAndGet());
            inserted.add(asset);
            return null;
        }).when(assetMapper).insert(any(Asset.class));

        stage = new MediaStage(episodeUpdateService, seriesConfigService, scriptMapper, assetMapper, ttsService,
                imageGeneratorService, ffmpegService, storageService, pipelineConfig, objectMapper);
    }

    private void givenScript(String scenesJson) {
        when(scriptMapper.findById(33L)).thenReturn(Optional.of(Script.builder()
                .scriptId(33L).seriesId(1L).text("Rain on glass.\n\nA door creaks.").scenes(scenesJson).build()));
    }

    private JsonNode savedManifest() throws Exception {
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(episodeUpdateService).saveManifest(eq(lease), json.capture());
        return objectMapper.readTree(json.getValue());
    }

    // ==================== Scene mode ====================

    @Test
    @DisplayName("Each scene gets narration, measured duration and an optional image")
    void testExecute_SceneMode() throws Exception {
        givenScript(SCENES_JSON);
        when(ffmpegService.probeDuration(any(), eq(MediaStage.DEFAULT_SCENE_SECONDS))).thenReturn(3.2, 4.5);
        when(imageGeneratorService.generateSceneImage("window", 0)).thenReturn(Optional.of(new byte[]{9}));
        when(imageGeneratorService.generateSceneImage("hallway", 1)).thenReturn(Optional.empty());

        StageOutcome outcome = stage.execute(7L, LEASE_UNTIL);

        assertEquals(StageOutcome.COMPLETED, outcome);
        verify(episodeUpdateService).startMedia(lease);
        verify(ttsService).synthesize("Rain on glass.", OpenAiVoice.ONYX);

        JsonNode manifest = savedManifest();
        JsonNode scenes = manifest.get("scenes");
        assertEquals(2, scenes.size());
        assertEquals("1", scenes.get(0).get("voice_asset_id").asText());
        assertEquals("2", scenes.get(0).get("image_asset_id").asText());
        assertEquals(3.2, scenes.get(0).get("duration_seconds").asDouble());
        assertEquals("3", scenes.get(1).get("voice_asset_id").asText());
        assertTrue(scenes.get(1).get("image_asset_id").isNull());
        assertEquals(4.5, scenes.get(1).get("duration_seconds").asDouble());
        assertEquals("4", manifest.get("caption_asset_id").asText());
        assertFalse(manifest.has("voice_asset_id"));
        assertFalse(manifest.has("image_asset_id"));

        Asset firstVoice = inserted.get(0);
        assertEquals(AssetType.AUDIO, firstVoice.getType());
        assertEquals(3.2, firstVoice.getDurationSeconds());
        assertEquals("https://bucket.s3.amazonaws.com/workspaces/10/episodes/7/scene_0_voice.mp3", firstVoice.getUrl());
        JsonNode voiceMeta = objectMapper.readTree(firstVoice.getMetadata());
        assertEquals("scene_voice", voiceMeta.get("role").asText());
        assertEquals(0, voiceMeta.get("scene_index").asInt());
        assertEquals(AssetType.CAPTION_FILE, inserted.get(3).getType());
    }

    @Test
    @DisplayName("Manifest written by media can be read back")
    void testExecute_ManifestReadable() throws Exception {
        givenScript(SCENES_JSON);
        when(ffmpegService.probeDuration(any(), anyDouble())).thenReturn(5.0);
        when(imageGeneratorService.generateSceneImage(anyString(), anyInt())).thenReturn(Optional.empty());

        stage.execute(7L, LEASE_UNTIL);

        MediaManifest manifest = objectMapper.treeToValue(savedManifest(), MediaManifest.class);
        assertTrue(manifest.isSceneMode());
        assertEquals(1L, manifest.getScenes().get(0).getVoiceAssetId());
        assertNull(manifest.getScenes().get(0).getImageAssetId());
    }

    // ==================== Legacy mode ====================

    @Test
    @DisplayName("Without scenes a single narration and cover are produced")
    void testExecute_SingleMode() throws Exception {
        givenScript(null);
        when(imageGeneratorService.generateCoverImage(anyString())).thenReturn(Optional.of(new byte[]{9}));

        assertEquals(StageOutcome.COMPLETED, stage.execute(7L, LEASE_UNTIL));

        JsonNode manifest = savedManifest();
        assertFalse(manifest.has("scenes"));
        assertEquals("1", manifest.get("voice_asset_id").asText());
        assertEquals("2", manifest.get("caption_asset_id").asText());
        assertEquals("3", manifest.get("image_asset_id").asText());
        verify(ttsService).synthesize("Rain on glass.\n\nA door creaks.", OpenAiVoice.ONYX);
        verify(ffmpegService, never()).probeDuration(any(), anyDouble());
    }

    @Test
    @DisplayName("Legacy manifest keeps image_asset_id as null when there is no cover")
    void testExecute_SingleModeNoCover() throws Exception {
        givenScript(null);
        when(imageGeneratorService.generateCoverImage(anyString())).thenReturn(Optional.empty());

        assertEquals(StageOutcome.COMPLETED, stage.execute(7L, LEASE_UNTIL));

        JsonNode manifest = savedManifest();
        assertTrue(manifest.has("image_asset_id"));
        assertTrue(manifest.get("image_asset_id").isNull());
        assertEquals("1", manifest.get("voice_asset_id").asText());

        MediaManifest readBack = objectMapper.treeToValue(manifest, MediaManifest.class);
        assertFalse(readBack.isSceneMode());
        assertNull(readBack.getImageAssetId());
        assertEquals(1L, readBack.getVoiceAssetId());
    }

    // ==================== Image safety fallback ====================

    @Test
    @DisplayName("A scene blocked by the safety filter still gets an image from the fallback prompt")
    void testExecute_SafetyFallbackScene() throws Exception {
        givenScript("[{\"scene\":1,\"text\":\"Rain on glass.\",\"visual_description\":\"window\"},"
                + "{\"scene\":2,\"text\":\"A door creaks.\",\"visual_description\":\"hallway\"},"
                + "{\"scene\":3,\"text\":\"Something waits.\",\"visual_description\":\"bloody figure\"}]");
        when(ffmpegService.probeDuration(any(), anyDouble())).thenReturn(4.0);

        OpenAiClient openAiClient = mock(OpenAiClient.class);
        when(openAiClient.isConfigured()).thenReturn(true);
        doThrow(new ApiException(ErrorCode.IMAGE_GENERATION_FAILED, "Image API error"))
                .when(openAiClient).image(anyString(), anyString(), anyString());
        String blockedPrompt = ImagePromptBuilder.scenePrompt("bloody figure");
        doThrow(new SafetyFilterException(blockedPrompt, "content_policy_violation"))
                .when(openAiClient).image(anyString(), eq(blockedPrompt), anyString());
        doReturn(new byte[]{7, 7})
                .when(openAiClient).image(anyString(), eq(ImagePromptBuilder.SAFE_FALLBACK_PROMPT), anyString());
        OpenAiImageGeneratorServiceImpl imageService = new OpenAiImageGeneratorServiceImpl(openAiClient);
        ReflectionTestUtils.setField(imageService, "enabled", true);
        ReflectionTestUtils.setField(imageService, "imageModel", "dall-e-3");
        stage = new MediaStage(episodeUpdateService, seriesConfigService, scriptMapper, assetMapper, ttsService,
                imageService, ffmpegService, storageService, pipelineConfig, objectMapper);

        assertEquals(StageOutcome.COMPLETED, stage.execute(7L, LEASE_UNTIL));

        JsonNode scenes = savedManifest().get("scenes");
        assertEquals(3, scenes.size());
        assertTrue(scenes.get(0).get("image_asset_id").isNull());
        assertTrue(scenes.get(1).get("image_asset_id").isNull());
        assertFalse(scenes.get(2).get("image_asset_id").isNull());
        assertEquals("4", scenes.get(2).get("image_asset_id").asText());
        assertEquals(AssetType.IMAGE, inserted.get(3).getType());
        verify(storageService).upload(anyString(), eq(new byte[]{7, 7}), eq("image/png"));
    }

    // ==================== Failures ====================

    @Test
    @DisplayName("Missing series fails the stage under the lease")
    void testExecute_SeriesMissing() {
        when(seriesConfigService.getConfig(1L))
                .thenThrow(new ApiException(ErrorCode.SERIES_NOT_FOUND, "Series 1 not found"));

        ApiException e = assertThrows(ApiException.class, () -> stage.execute(7L, LEASE_UNTIL));

        assertEquals(ErrorCode.SERIES_NOT_FOUND, e.getErrorCode());
        verify(episodeUpdateService).acquire(any(Episode.class), eq(PipelineStage.MEDIA), eq(LEASE_UNTIL));
        verify(episodeUpdateService).markFailed(lease, "Series 1 not found", null);
        verify(episodeUpdateService, never()).saveManifest(any(), any());
    }

    @Test
    @DisplayName("Narration failure fails the stage")
    void testExecute_TtsFailure() {
        givenScript(SCENES_JSON);
        when(ttsService.synthesize(anyString(), any()))
                .thenThrow(new ApiException(ErrorCode.TTS_GENERATION_FAILED, "TTS API error"));

        assertThrows(ApiException.class, () -> stage.execute(7L, LEASE_UNTIL));

        verify(episodeUpdateService).markFailed(lease, "TTS API error", null);
        verify(episodeUpdateService, never()).saveManifest(any(), any());
    }

    @Test
    @DisplayName("Missing script text fails the stage")
    void testExecute_NoScript() {
        when(scriptMapper.findById(33L)).thenReturn(Optional.empty());

        ApiException e = assertThrows(ApiException.class, () -> stage.execute(7L, LEASE_UNTIL));

        assertEquals(ErrorCode.SCRIPT_NOT_FOUND, e.getErrorCode());
        verify(episodeUpdateService).markFailed(lease, "Script 33 not found", null);
    }

    @Test
    @DisplayName("Scheduled episodes are skipped")
    void testExecute_Skipped() {
        when(episodeUpdateService.getEpisode(7L)).thenReturn(Episode.builder()
                .episodeId(7L).seriesId(1L).status(EpisodeStatus.SCHEDULED).build());

        assertEquals(StageOutcome.SKIPPED, stage.execute(7L, LEASE_UNTIL));

        verify(episodeUpdateService, never()).acquire(any(), any(), any());
    }

    @Test
    @DisplayName("A redelivered run after the manifest was saved completes without redoing work")
    void testExecute_ManifestAlreadySaved() {
        when(episodeUpdateService.getEpisode(7L)).thenReturn(Episode.builder()
                .episodeId(7L).seriesId(1L).scriptId(33L).status(EpisodeStatus.GENERATING)
                .currentStage(PipelineStage.MEDIA).mediaManifest("{\"voice_asset_id\":\"1\"}").build());

        assertEquals(StageOutcome.COMPLETED, stage.execute(7L, LEASE_UNTIL));

        verify(episodeUpdateService, never()).acquire(any(), any(), any());
        verify(ttsService, never()).synthesize(anyString(), any());
    }

    @Test
    @DisplayName("A manifest under a live lease is not treated as finished")
    void testIsAlreadySynthesized_Leased() {
        assertFalse(MediaStage.isAlreadySynthesized(Episode.builder().status(EpisodeStatus.GENERATING)
                .currentStage(PipelineStage.MEDIA).mediaManifest("{}").leaseToken("other").build()));
        assertFalse(MediaStage.isAlreadySynthesized(Episode.builder().status(EpisodeStatus.GENERATING)
                .currentStage(PipelineStage.RENDER).mediaManifest("{}").build()));
    }

    // ==================== Music ====================

    @Test
    @DisplayName("Music falls back to the library track when the upload belongs elsewhere")
    void testResolveMusic() {
        SeriesDto.Config config = SeriesDto.Config.builder()
                .workspaceId(10L)
                .musicSettings(SeriesDto.MusicSettings.builder().customUploadAssetId("50").libraryTrackId("60").build())
                .build();
        when(assetMapper.findById(50L)).thenReturn(Optional.of(
                Asset.builder().assetId(50L).workspaceId(99L).type(AssetType.MUSIC).build()));
        when(assetMapper.findById(60L)).thenReturn(Optional.of(
                Asset.builder().assetId(60L).workspaceId(10L).type(AssetType.MUSIC).build()));

        assertEquals(60L, stage.resolveMusic(config));
    }

    @Test
    @DisplayName("Non-numeric or non-music references resolve to no music")
    void testResolveMusic_None() {
        SeriesDto.Config config = SeriesDto.Config.builder()
                .workspaceId(10L)
                .musicSettings(SeriesDto.MusicSettings.builder().customUploadAssetId("calm-piano").libraryTrackId("61").build())
                .build();
        when(assetMapper.findById(61L)).thenReturn(Optional.of(
                Asset.builder().assetId(61L).workspaceId(10L).type(AssetType.IMAGE).build()));

        assertNull(stage.resolveMusic(config));
    }
}
