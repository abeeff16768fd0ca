package com.autoviral.worker.service.schedule;

import com.autoviral.common.enums.EpisodeStatus;
import com.autoviral.common.enums.PipelineStage;
import com.autoviral.common.exception.ApiException;
import com.autoviral.common.exception.ErrorCode;
import com.autoviral.worker.config.PipelineConfig;
import com.autoviral.worker.dto.SeriesDto;
import com.autoviral.worker.entity.Episode;
import com.autoviral.worker.entity.Series;
import com.autoviral.worker.mapper.EpisodeMapper;
import com.autoviral.worker.mapper.SeriesMapper;
import com.autoviral.worker.service.pipeline.TaskQueueService;
import com.autoviral.worker.service.series.CreditEstimator;
import com.autoviral.worker.service.series.SeriesConfigService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 시리즈 발행 일정 → 에피소드 생성 + 대본 작업 예약
 *
 * 대본 작업은 발행 시각 pipeline.script-lead-hours(기본 6시간) 전에 실행되도록 예약하고,
 * 그 시각이 이미 지났으면 바로 실행한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EpisodeSchedulingService {

    static final int LAUNCH_EPISODES = 7;
    static final int TOP_UP_SLOTS = 14;

    private final SeriesMapper seriesMapper;
    private final EpisodeMapper episodeMapper;
    private final SeriesConfigService seriesConfigService;
    private final RecurrenceService recurrenceService;
    private final CreditEstimator creditEstimator;
    private final TaskQueueService taskQueueService;
    private final PipelineConfig pipelineConfig;

    /**
     * 시리즈 시작: 다음 7개 발행 슬롯에 에피소드 생성, ACTIVE 로 전환
     */
    @Transactional
    public SeriesDto.LaunchResult launch(Long seriesId) {
        Series series = seriesConfigService.getSeries(seriesId);
        if (series.getStatus() == null || !series.getStatus().isLaunchable()) {
            throw new ApiException(ErrorCode.SERIES_INVALID_STATUS, "Series cannot be launched in current state");
        }
        SeriesDto.Config config = seriesConfigService.getConfig(series);
        if (config.getScriptPreferences() == null || config.getVoiceLanguage() == null) {
            throw new ApiException(ErrorCode.SERIES_INCOMPLETE, "Complete required wizard steps before launch");
        }

        SeriesDto.CreditEstimate estimate = creditEstimator.estimate(config);
        boolean autoPost = !config.getConnectedSocialAccountIds().isEmpty();
        if (seriesMapper.updateAsLaunched(seriesId, autoPost, estimate.getPerEpisode()) == 0) {
            throw new ApiException(ErrorCode.SERIES_INVALID_STATUS, "Series cannot be launched in current state");
        }

        List<LocalDateTime> slots = recurrenceService.nextPublishSlotsUtc(config.getSchedule(), LAUNCH_EPISODES);
        List<SeriesDto.UpcomingEpisode> upcoming = new ArrayList<>();
        int sequence = 0;
        for (LocalDateTime slot : slots) {
            Episode episode = createEpisode(seriesId, ++sequence, slot);
            upcoming.add(SeriesDto.UpcomingEpisode.builder()
                    .episodeId(episode.getEpisodeId())
                    .sequenceNumber(episode.getSequenceNumber())
                    .scheduledAt(episode.getScheduledAt())
                    .status(episode.getStatus())
                    .build());
        }
        log.info("[Schedule] seriesId={} launched, {} episodes, autoPost={}, credits/episode={}",
                seriesId, upcoming.size(), autoPost, estimate.getPerEpisode());

        return SeriesDto.LaunchResult.builder()
                .seriesId(seriesId)
                .upcomingEpisodes(upcoming)
                .creditEstimate(estimate)
                .autoPostEnabled(autoPost)
                .build();
    }

    /**
     * 다음 14개 슬롯 중 아직 에피소드가 없는 날짜(UTC)에만 생성. 일정이 비활성이면 건너뜀.
     * @return 새로 만든 에피소드 수
     */
    @Transactional
    public int scheduleUpcoming(Long seriesId) {
        Series series = seriesMapper.findById(seriesId).orElse(null);
        if (series == null) {
            log.warn("[Schedule] seriesId={} not found, nothing scheduled", seriesId);
            return 0;
        }
        SeriesDto.Schedule schedule = seriesConfigService.getConfig(series).getSchedule();
        if (Boolean.FALSE.equals(schedule.getActive())) {
            log.debug("[Schedule] seriesId={} schedule inactive", seriesId);
            return 0;
        }

        List<Episode> existing = episodeMapper.findBySeriesId(seriesId);
        Set<LocalDate> takenDates = new HashSet<>();
        for (Episode episode : existing) {
            if (episode.getScheduledAt() != null) {
                takenDates.add(episode.getScheduledAt().toLocalDate());
            }
        }
        int sequence = existing.size();
        int created = 0;
        for (LocalDateTime slot : recurrenceService.nextPublishSlotsUtc(schedule, TOP_UP_SLOTS)) {
            if (!takenDates.add(slot.toLocalDate())) {
                continue;
            }
            createEpisode(seriesId, ++sequence, slot);
            created++;
        }
        if (created > 0) {
            log.info("[Schedule] seriesId={} scheduled {} new episode(s)", seriesId, created);
        }
        return created;
    }

    private Episode createEpisode(Long seriesId, int sequenceNumber, LocalDateTime scheduledAt) {
        Episode episode = Episode.builder()
                .seriesId(seriesId)
                .sequenceNumber(sequenceNumber)
                .scheduledAt(scheduledAt)
                .status(EpisodeStatus.SCHEDULED)
                .build();
        episodeMapper.insert(episode);
        taskQueueService.enqueueAt(PipelineStage.SCRIPT, episode.getEpisodeId(),
                scheduledAt.minusHours(pipelineConfig.getScriptLeadHours()));
        return episode;
    }
}
