package com.autoviral.worker.entity;

import com.autoviral.common.enums.PostStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Post {
    private Long postId;
    private Long episodeId;
    private Long socialAccountId;
    private String platformPostId;
    private PostStatus status;
    private String errorPayload;    // JSON
    private LocalDateTime postedAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
