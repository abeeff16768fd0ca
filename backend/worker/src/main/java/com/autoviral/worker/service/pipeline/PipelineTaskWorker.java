package com.autoviral.worker.service.pipeline;

import com.autoviral.common.enums.PipelineStage;
import com.autoviral.worker.config.PipelineConfig;
import com.autoviral.worker.entity.PipelineTask;
import com.autoviral.worker.mapper.PipelineTaskMapper;
import com.autoviral.worker.service.episode.StaleLeaseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Semaphore;

/**
 * 작업 큐 폴링 워커
 *
 * - 점유: claim UPDATE 로 RUNNING + lockedUntil 설정 (attempts 증가)
 * - 완료 ack 는 단계 실행이 끝난 뒤 (late ack). 워커가 죽으면 lockedUntil 이후 다른 워커가 다시 가져간다.
 * - 실패: 재시도 가능하면 백오프 후 QUEUED, 아니면 DEAD
 */
@Slf4j
@Component
public class PipelineTaskWorker {

    private static final int MAX_ERROR_LENGTH = 2000;

    private final PipelineTaskMapper taskMapper;
    private final PipelineDefinition pipelineDefinition;
    private final RetryPolicy retryPolicy;
    private final PipelineConfig pipelineConfig;
    private final TaskExecutor executor;
    private final Clock clock;
    private final Semaphore permits;
    private final String workerId;

    public PipelineTaskWorker(PipelineTaskMapper taskMapper,
                              PipelineDefinition pipelineDefinition,
                              RetryPolicy retryPolicy,
                              PipelineConfig pipelineConfig,
                              @Qualifier("pipelineExecutor") TaskExecutor executor,
                              Clock clock) {
        this.taskMapper = taskMapper;
        this.pipelineDefinition = pipelineDefinition;
        this.retryPolicy = retryPolicy;
        this.pipelineConfig = pipelineConfig;
        this.executor = executor;
        this.clock = clock;
        this.permits = new Semaphore(Math.max(1, pipelineConfig.getWorkerConcurrency()));
        this.workerId = hostName() + "-" + UUID.randomUUID().toString().substring(0, 8);
        log.info("[Worker] Started workerId={} concurrency={}", workerId, pipelineConfig.getWorkerConcurrency());
    }

    @Scheduled(fixedDelayString = "${pipeline.worker.poll-interval-ms:2000}")
    public void poll() {
        int free = permits.availablePermits();
        if (free == 0) {
            return;
        }
        LocalDateTime now = LocalDateTime.now(clock);
        List<PipelineTask> candidates = taskMapper.findClaimable(now, free);
        for (PipelineTask task : candidates) {
            if (!permits.tryAcquire()) {
                return;
            }
            LocalDateTime lockedUntil = now.plus(pipelineConfig.getVisibilityTimeout());
            if (taskMapper.claim(task.getTaskId(), workerId, lockedUntil, now) == 0) {
                permits.release();
                continue;
            }
            int attempt = (task.getAttempts() == null ? 0 : task.getAttempts()) + 1;
            dispatch(task, attempt, lockedUntil);
        }
    }

    private void dispatch(PipelineTask task, int attempt, LocalDateTime lockedUntil) {
        try {
            executor.execute(() -> {
                try {
                    runClaimed(task, attempt, lockedUntil);
                } finally {
                    permits.release();
                }
            });
        } catch (TaskRejectedException e) {
            permits.release();
            log.warn("[Worker] Executor rejected taskId={}, requeueing", task.getTaskId());
            taskMapper.reschedule(task.getTaskId(), workerId, LocalDateTime.now(clock), "executor rejected");
        }
    }

    /**
     * 점유된 작업 1건 실행 (동기)
     */
    void runClaimed(PipelineTask task, int attempt, LocalDateTime lockedUntil) {
        PipelineStage stage = task.getStage();
        Long targetId = task.getTargetId();
        log.info("[Worker] Running {} target={} attempt={}/{} taskId={}",
                stage, targetId, attempt, task.getMaxAttempts(), task.getTaskId());

        try {
            StageOutcome outcome = pipelineDefinition.handlerFor(stage).execute(targetId, lockedUntil);
            if (outcome == StageOutcome.COMPLETED) {
                pipelineDefinition.afterCompletion(stage, targetId);
            }
            taskMapper.markDone(task.getTaskId(), workerId);
            log.info("[Worker] {} target={} {}", stage, targetId, outcome);
        } catch (StaleLeaseException e) {
            // 더 새로운 실행이 에피소드를 가지고 있으므로 이번 결과는 버린다
            log.info("[Worker] {} target={} superseded: {}", stage, targetId, e.getMessage());
            taskMapper.markDone(task.getTaskId(), workerId);
        } catch (Exception e) {
            handleFailure(task, attempt, e);
        }
    }

    private void handleFailure(PipelineTask task, int attempt, Exception error) {
        String message = truncate(error.getClass().getSimpleName() + ": " + error.getMessage());
        int maxAttempts = task.getMaxAttempts() == null ? retryPolicy.getMaxAttempts() : task.getMaxAttempts();

        if (retryPolicy.shouldRetry(attempt, maxAttempts, error)) {
            LocalDateTime runAt = LocalDateTime.now(clock).plus(retryPolicy.delayAfter(attempt));
            taskMapper.reschedule(task.getTaskId(), workerId, runAt, message);
            log.warn("[Worker] {} target={} failed (attempt {}/{}), retry at {}: {}",
                    task.getStage(), task.getTargetId(), attempt, maxAttempts, runAt, message);
        } else {
            taskMapper.markDead(task.getTaskId(), workerId, message);
            log.error("[Worker] {} target={} abandoned after attempt {}: {}",
                    task.getStage(), task.getTargetId(), attempt, message, error);
        }
    }

    public String getWorkerId() {
        return workerId;
    }

    private static String truncate(String message) {
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "worker";
        }
    }
}
