package com.autoviral.worker.service.schedule;

import com.autoviral.common.enums.SeriesStatus;
import com.autoviral.worker.entity.Series;
import com.autoviral.worker.mapper.SeriesMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * ACTIVE 시리즈의 다가오는 에피소드 보충
 * 스케줄링 비활성화: pipeline.scheduler.enabled=false
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "pipeline.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class EpisodeScheduler {

    private final SeriesMapper seriesMapper;
    private final EpisodeSchedulingService episodeSchedulingService;

    @Scheduled(cron = "${pipeline.scheduler.top-up-cron:0 0 * * * *}")
    public void topUpActiveSeries() {
        List<Series> active = seriesMapper.findByStatus(SeriesStatus.ACTIVE);
        int total = 0;
        for (Series series : active) {
            try {
                total += episodeSchedulingService.scheduleUpcoming(series.getSeriesId());
            } catch (RuntimeException e) {
                log.error("[Scheduler] seriesId={} top-up failed", series.getSeriesId(), e);
            }
        }
        log.info("[Scheduler] top-up done: {} active series, {} new episode(s)", active.size(), total);
    }
}
