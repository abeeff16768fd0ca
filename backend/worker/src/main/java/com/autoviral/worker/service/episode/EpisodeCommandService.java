package com.autoviral.worker.service.episode;

import com.autoviral.common.enums.EpisodeStatus;
import com.autoviral.common.enums.PipelineStage;
import com.autoviral.common.exception.ApiException;
import com.autoviral.common.exception.ErrorCode;
import com.autoviral.worker.entity.Episode;
import com.autoviral.worker.service.pipeline.TaskQueueService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 사용자가 직접 실행하는 에피소드 명령
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EpisodeCommandService {

    private final EpisodeUpdateService episodeUpdateService;
    private final TaskQueueService taskQueueService;

    /**
     * 대본 재생성. SCHEDULED/FAILED 에서만 가능.
     * @return 등록된 작업 ID
     */
    public Long regenerateScript(Long episodeId) {
        Episode episode = episodeUpdateService.getEpisode(episodeId);
        if (!episode.getStatus().canStartScript()) {
            throw new ApiException(ErrorCode.EPISODE_INVALID_STATUS,
                    "Script can only be generated from scheduled or failed, current: " + episode.getStatus().getCode());
        }
        Long taskId = taskQueueService.enqueue(PipelineStage.SCRIPT, episodeId);
        log.info("[EpisodeCommand] episodeId={} script regeneration queued, taskId={}", episodeId, taskId);
        return taskId;
    }

    /**
     * 미디어 생성 (완료되면 렌더까지 이어서 실행). 대본이 있어야 한다.
     */
    public Long generateMedia(Long episodeId) {
        Episode episode = episodeUpdateService.getEpisode(episodeId);
        if (episode.getScriptId() == null) {
            throw new ApiException(ErrorCode.SCRIPT_NOT_FOUND, "Generate script first");
        }
        if (!episode.getStatus().canStartMedia()) {
            throw new ApiException(ErrorCode.EPISODE_INVALID_STATUS,
                    "Media cannot be generated in status " + episode.getStatus().getCode());
        }
        Long taskId = taskQueueService.enqueue(PipelineStage.MEDIA, episodeId);
        log.info("[EpisodeCommand] episodeId={} media generation queued, taskId={}", episodeId, taskId);
        return taskId;
    }

    /**
     * 검토 완료 → APPROVED
     */
    public void approve(Long episodeId) {
        Episode episode = episodeUpdateService.getEpisode(episodeId);
        if (!episodeUpdateService.transition(episodeId, episode.getStatus(), EpisodeStatus.APPROVED)) {
            throw new ApiException(ErrorCode.EPISODE_INVALID_STATUS,
                    "Episode " + episodeId + " changed while approving, current: " + episode.getStatus().getCode());
        }
        log.info("[EpisodeCommand] episodeId={} approved", episodeId);
    }
}
