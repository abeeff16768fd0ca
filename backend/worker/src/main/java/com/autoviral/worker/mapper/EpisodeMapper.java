package com.autoviral.worker.mapper;

import com.autoviral.common.enums.EpisodeStatus;
import com.autoviral.common.enums.PipelineStage;
import com.autoviral.worker.entity.Episode;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 에피소드 매퍼
 * 파이프라인 단계의 쓰기는 모두 leaseToken 조건부이며, 반영된 행 수(0/1)를 돌려준다.
 */
@Mapper
public interface EpisodeMapper {

    void insert(Episode episode);

    Optional<Episode> findById(Long episodeId);

    List<Episode> findBySeriesId(Long seriesId);

    int countBySeriesId(Long seriesId);

    /**
     * version CAS 로 단계 점유. 다른 실행이 점유 중이고 만료 전이면 실패.
     */
    int acquireLease(@Param("episodeId") Long episodeId,
                     @Param("expectedVersion") Long expectedVersion,
                     @Param("stage") PipelineStage stage,
                     @Param("leaseToken") String leaseToken,
                     @Param("leaseExpiresAt") LocalDateTime leaseExpiresAt,
                     @Param("now") LocalDateTime now);

    int updateStatus(@Param("episodeId") Long episodeId,
                     @Param("leaseToken") String leaseToken,
                     @Param("status") EpisodeStatus status);

    /**
     * 미디어 단계 시작: GENERATING + 이전 매니페스트 제거
     */
    int startMedia(@Param("episodeId") Long episodeId,
                   @Param("leaseToken") String leaseToken);

    /**
     * 스크립트 완료: 스크립트 연결, READY_FOR_REVIEW, 오류 초기화, 점유 해제
     */
    int markScriptReady(@Param("episodeId") Long episodeId,
                        @Param("leaseToken") String leaseToken,
                        @Param("scriptId") Long scriptId);

    /**
     * 미디어 완료: 매니페스트 저장, 점유 해제 (상태는 GENERATING 유지)
     */
    int saveManifest(@Param("episodeId") Long episodeId,
                     @Param("leaseToken") String leaseToken,
                     @Param("mediaManifest") String mediaManifest);

    /**
     * 렌더 완료: 영상 연결, READY_FOR_REVIEW, 오류/매니페스트 초기화, 점유 해제
     */
    int markRendered(@Param("episodeId") Long episodeId,
                     @Param("leaseToken") String leaseToken,
                     @Param("videoAssetId") Long videoAssetId,
                     @Param("previewUrl") String previewUrl);

    int markFailed(@Param("episodeId") Long episodeId,
                   @Param("leaseToken") String leaseToken,
                   @Param("errorPayload") String errorPayload);

    /**
     * 점유 중이 아닌 에피소드의 상태 전이 (사용자 승인 등)
     */
    int updateStatusIfCurrent(@Param("episodeId") Long episodeId,
                              @Param("expected") EpisodeStatus expected,
                              @Param("status") EpisodeStatus status);
}
