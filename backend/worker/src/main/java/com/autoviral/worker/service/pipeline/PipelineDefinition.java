package com.autoviral.worker.service.pipeline;

import com.autoviral.common.enums.PipelineStage;
import com.autoviral.worker.service.publish.PublishService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 파이프라인 정의
 *
 * 에피소드 단계: SCRIPT → MEDIA → RENDER (입력: episodeId, 산출물: script / media_manifest / video asset)
 * RENDER 완료 후 시리즈 자동 게시가 켜져 있으면 게시 트리거. PUBLISH 는 postId 단위 단계로 후속 단계가 없다.
 */
@Slf4j
@Component
public class PipelineDefinition {

    static final List<PipelineStage> EPISODE_STAGES =
            List.of(PipelineStage.SCRIPT, PipelineStage.MEDIA, PipelineStage.RENDER);

    private final Map<PipelineStage, StageHandler> handlers = new EnumMap<>(PipelineStage.class);
    private final TaskQueueService taskQueueService;
    private final PublishService publishService;

    public PipelineDefinition(List<StageHandler> stageHandlers,
                              TaskQueueService taskQueueService,
                              PublishService publishService) {
        for (StageHandler handler : stageHandlers) {
            StageHandler previous = handlers.put(handler.getStage(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handler for stage " + handler.getStage());
            }
        }
        for (PipelineStage stage : PipelineStage.values()) {
            if (!handlers.containsKey(stage)) {
                throw new IllegalStateException("No handler registered for stage " + stage);
            }
        }
        this.taskQueueService = taskQueueService;
        this.publishService = publishService;
    }

    public StageHandler handlerFor(PipelineStage stage) {
        return handlers.get(stage);
    }

    public Optional<PipelineStage> nextStage(PipelineStage stage) {
        int index = EPISODE_STAGES.indexOf(stage);
        if (index < 0 || index == EPISODE_STAGES.size() - 1) {
            return Optional.empty();
        }
        return Optional.of(EPISODE_STAGES.get(index + 1));
    }

    /**
     * 단계 완료 후 후속 작업 등록. 재전달된 작업이 다시 완료돼도 후속 작업은 하나만 남는다.
     */
    public void afterCompletion(PipelineStage stage, Long targetId) {
        Optional<PipelineStage> next = nextStage(stage);
        if (next.isPresent()) {
            taskQueueService.enqueueIfAbsent(next.get(), targetId);
            return;
        }
        if (stage == PipelineStage.RENDER) {
            publishService.autoPublish(targetId);
        }
    }
}
