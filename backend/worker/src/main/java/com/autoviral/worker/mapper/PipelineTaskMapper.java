package com.autoviral.worker.mapper;

import com.autoviral.common.enums.PipelineStage;
import com.autoviral.worker.entity.PipelineTask;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 작업 큐 매퍼
 * 점유 가능한 작업: QUEUED 이면서 runAt 도래, 또는 RUNNING 이면서 lockedUntil 경과(워커 중단 → 재전달)
 */
@Mapper
public interface PipelineTaskMapper {

    void insert(PipelineTask task);

    Optional<PipelineTask> findById(Long taskId);

    /**
     * 같은 단계/대상의 아직 끝나지 않은(QUEUED, RUNNING) 작업
     */
    Optional<PipelineTask> findPending(@Param("stage") PipelineStage stage, @Param("targetId") Long targetId);

    List<PipelineTask> findClaimable(@Param("now") LocalDateTime now, @Param("limit") int limit);

    /**
     * 점유 (attempts 1 증가)
     * @return 0 이면 다른 워커가 먼저 가져갔다
     */
    int claim(@Param("taskId") Long taskId,
              @Param("workerId") String workerId,
              @Param("lockedUntil") LocalDateTime lockedUntil,
              @Param("now") LocalDateTime now);

    int markDone(@Param("taskId") Long taskId, @Param("workerId") String workerId);

    int reschedule(@Param("taskId") Long taskId,
                   @Param("workerId") String workerId,
                   @Param("runAt") LocalDateTime runAt,
                   @Param("lastError") String lastError);

    int markDead(@Param("taskId") Long taskId,
                 @Param("workerId") String workerId,
                 @Param("lastError") String lastError);
}
