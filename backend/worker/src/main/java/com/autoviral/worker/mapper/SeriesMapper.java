package com.autoviral.worker.mapper;

import com.autoviral.common.enums.SeriesStatus;
import com.autoviral.worker.entity.Series;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;
import java.util.Optional;

@Mapper
public interface SeriesMapper {

    Optional<Series> findById(Long seriesId);

    List<Series> findByStatus(@Param("status") SeriesStatus status);

    /**
     * 시작 처리 (DRAFT/PAUSED 일 때만 반영)
     * @return 0 이면 그 사이 다른 요청이 상태를 바꿨다
     */
    int updateAsLaunched(@Param("seriesId") Long seriesId,
                         @Param("autoPostEnabled") boolean autoPostEnabled,
                         @Param("estimatedCreditsPerVideo") double estimatedCreditsPerVideo);
}
