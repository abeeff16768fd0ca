package com.autoviral.worker.mapper;

import com.autoviral.worker.entity.Post;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Mapper
public interface PostMapper {

    void insert(Post post);

    Optional<Post> findById(Long postId);

    List<Post> findByEpisodeId(Long episodeId);

    /**
     * POSTED 가 아닌 경우에만 POSTING 으로 (이미 게시된 건은 재전달되어도 다시 올리지 않는다)
     * @return 0 이면 이미 게시됨
     */
    int markPosting(Long postId);

    void markPosted(@Param("postId") Long postId,
                    @Param("platformPostId") String platformPostId,
                    @Param("postedAt") LocalDateTime postedAt);

    void markFailed(@Param("postId") Long postId,
                    @Param("errorPayload") String errorPayload);

    /**
     * 상태는 그대로 두고 오류 내용만 기록 (게시 전 검증 실패)
     */
    void recordError(@Param("postId") Long postId,
                     @Param("errorPayload") String errorPayload);
}
