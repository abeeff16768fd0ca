package com.autoviral.worker.entity;

import com.autoviral.common.enums.PipelineStage;
import com.autoviral.common.enums.TaskStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 작업 큐 행. targetId 는 PUBLISH 면 postId, 나머지는 episodeId.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineTask {
    private Long taskId;
    private PipelineStage stage;
    private Long targetId;
    private TaskStatus status;
    private Integer attempts;
    private Integer maxAttempts;
    private LocalDateTime runAt;
    private LocalDateTime lockedUntil;
    private String workerId;
    private String lastError;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
