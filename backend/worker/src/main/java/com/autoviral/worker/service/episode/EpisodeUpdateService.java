package com.autoviral.worker.service.episode;

import com.autoviral.common.enums.EpisodeStatus;
import com.autoviral.common.enums.PipelineStage;
import com.autoviral.common.exception.ApiException;
import com.autoviral.common.exception.ErrorCode;
import com.autoviral.worker.entity.Episode;
import com.autoviral.worker.mapper.EpisodeMapper;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * 에피소드 상태 쓰기 전용 서비스
 *
 * 모든 쓰기는 독립 트랜잭션(REQUIRES_NEW)으로 즉시 커밋한다. TTS/이미지/ffmpeg 같은 긴 작업 중에
 * 트랜잭션을 잡고 있지 않기 위함이다. 점유 토큰이 맞지 않아 0행이 반영되면 StaleLeaseException.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EpisodeUpdateService {

    private final EpisodeMapper episodeMapper;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public Episode getEpisode(Long episodeId) {
        return episodeMapper.findById(episodeId)
                .orElseThrow(() -> new ApiException(ErrorCode.EPISODE_NOT_FOUND, "Episode " + episodeId + " not found"));
    }

    /**
     * 읽은 시점의 version 으로 CAS 점유. 만료 전의 다른 점유가 있거나 그 사이 version 이 바뀌면 실패.
     * @param leaseUntil 작업 점유 만료 시각과 같게 준다 (작업이 재전달될 때는 점유도 만료되어 있다)
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public EpisodeLease acquire(Episode episode, PipelineStage stage, LocalDateTime leaseUntil) {
        String token = UUID.randomUUID().toString();
        LocalDateTime now = LocalDateTime.now(clock);
        int updated = episodeMapper.acquireLease(episode.getEpisodeId(), episode.getVersion(), stage, token, leaseUntil, now);
        if (updated == 0) {
            throw new StaleLeaseException(episode.getEpisodeId(),
                    "Episode " + episode.getEpisodeId() + " is held by another run (" + episode.getCurrentStage() + ")");
        }
        log.debug("[EpisodeUpdate] episodeId={} lease acquired stage={}", episode.getEpisodeId(), stage);
        return new EpisodeLease(episode.getEpisodeId(), stage, token);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markGenerating(EpisodeLease lease) {
        require(episodeMapper.updateStatus(lease.getEpisodeId(), lease.getToken(), EpisodeStatus.GENERATING), lease);
        log.info("[EpisodeUpdate] episodeId={} status=generating stage={}", lease.getEpisodeId(), lease.getStage());
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void startMedia(EpisodeLease lease) {
        require(episodeMapper.startMedia(lease.getEpisodeId(), lease.getToken()), lease);
        log.info("[EpisodeUpdate] episodeId={} status=generating, manifest cleared", lease.getEpisodeId());
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markScriptReady(EpisodeLease lease, Long scriptId) {
        require(episodeMapper.markScriptReady(lease.getEpisodeId(), lease.getToken(), scriptId), lease);
        log.info("[EpisodeUpdate] episodeId={} status=ready_for_review scriptId={}", lease.getEpisodeId(), scriptId);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void saveManifest(EpisodeLease lease, String manifestJson) {
        require(episodeMapper.saveManifest(lease.getEpisodeId(), lease.getToken(), manifestJson), lease);
        log.info("[EpisodeUpdate] episodeId={} media manifest saved", lease.getEpisodeId());
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markRendered(EpisodeLease lease, Long videoAssetId, String previewUrl) {
        require(episodeMapper.markRendered(lease.getEpisodeId(), lease.getToken(), videoAssetId, previewUrl), lease);
        log.info("[EpisodeUpdate] episodeId={} status=ready_for_review videoAssetId={}", lease.getEpisodeId(), videoAssetId);
    }

    /**
     * FAILED + {step, message}
     * @param previousPayload null 이 아니면 기존 진단 필드를 유지한 채 step/message 를 덮어쓴다
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(EpisodeLease lease, String message, String previousPayload) {
        Map<String, Object> payload = new LinkedHashMap<>(parsePayload(previousPayload));
        payload.put("step", lease.getStage().getErrorStep());
        payload.put("message", message);
        require(episodeMapper.markFailed(lease.getEpisodeId(), lease.getToken(), toJson(payload)), lease);
        log.warn("[EpisodeUpdate] episodeId={} status=failed step={} message={}",
                lease.getEpisodeId(), lease.getStage().getErrorStep(), message);
    }

    /**
     * 점유 없이 상태만 바꾸는 사용자 동작 (승인 등)
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean transition(Long episodeId, EpisodeStatus expected, EpisodeStatus target) {
        if (!expected.canTransitionTo(target)) {
            throw new ApiException(ErrorCode.EPISODE_INVALID_STATUS,
                    "Cannot move episode from " + expected.getCode() + " to " + target.getCode());
        }
        return episodeMapper.updateStatusIfCurrent(episodeId, expected, target) == 1;
    }

    Map<String, Object> parsePayload(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
            return parsed != null ? parsed : Map.of();
        } catch (JsonProcessingException e) {
            log.warn("[EpisodeUpdate] Previous error payload is not a JSON object, replacing it");
            return Map.of();
        }
    }

    private String toJson(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new ApiException(ErrorCode.INTERNAL_SERVER_ERROR, "Failed to serialize error payload", e);
        }
    }

    private void require(int updatedRows, EpisodeLease lease) {
        if (updatedRows == 0) {
            throw new StaleLeaseException(lease.getEpisodeId(),
                    "Lease for episode " + lease.getEpisodeId() + " (" + lease.getStage() + ") was taken over");
        }
    }
}
