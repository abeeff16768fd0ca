package com.autoviral.worker.service.pipeline;

import com.autoviral.common.enums.PipelineStage;
import com.autoviral.common.enums.TaskStatus;
import com.autoviral.worker.entity.PipelineTask;
import com.autoviral.worker.mapper.PipelineTaskMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 작업 큐 등록 (pipeline_task 테이블)
 * 등록 시각이 과거면 즉시 실행 대상이 된다. 등록된 작업은 취소하지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskQueueService {

    private final PipelineTaskMapper taskMapper;
    private final RetryPolicy retryPolicy;
    private final Clock clock;

    public Long enqueue(PipelineStage stage, Long targetId) {
        return enqueueAt(stage, targetId, LocalDateTime.now(clock));
    }

    /**
     * 단계 연결용. 같은 단계/대상 작업이 이미 대기 중이거나 실행 중이면 새로 만들지 않는다.
     */
    public Long enqueueIfAbsent(PipelineStage stage, Long targetId) {
        Optional<PipelineTask> pending = taskMapper.findPending(stage, targetId);
        if (pending.isPresent()) {
            log.info("[TaskQueue] {} target={} already pending as taskId={}", stage, targetId, pending.get().getTaskId());
            return pending.get().getTaskId();
        }
        return enqueue(stage, targetId);
    }

    public Long enqueueAt(PipelineStage stage, Long targetId, LocalDateTime runAt) {
        LocalDateTime now = LocalDateTime.now(clock);
        PipelineTask task = PipelineTask.builder()
                .stage(stage)
                .targetId(targetId)
                .status(TaskStatus.QUEUED)
                .attempts(0)
                .maxAttempts(retryPolicy.getMaxAttempts())
                .runAt(runAt == null || runAt.isBefore(now) ? now : runAt)
                .build();
        taskMapper.insert(task);
        log.info("[TaskQueue] Enqueued {} target={} runAt={} taskId={}", stage, targetId, task.getRunAt(), task.getTaskId());
        return task.getTaskId();
    }
}
