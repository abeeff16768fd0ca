package com.autoviral.worker.service.publish;

import com.autoviral.common.enums.PipelineStage;
import com.autoviral.common.enums.PostStatus;
import com.autoviral.common.exception.ApiException;
import com.autoviral.common.exception.ErrorCode;
import com.autoviral.worker.dto.PublishDto;
import com.autoviral.worker.dto.SeriesDto;
import com.autoviral.worker.entity.Asset;
import com.autoviral.worker.entity.Episode;
import com.autoviral.worker.entity.Post;
import com.autoviral.worker.entity.Series;
import com.autoviral.worker.entity.SocialAccount;
import com.autoviral.worker.mapper.AssetMapper;
import com.autoviral.worker.mapper.EpisodeMapper;
import com.autoviral.worker.mapper.PostMapper;
import com.autoviral.worker.mapper.SocialAccountMapper;
import com.autoviral.worker.service.pipeline.TaskQueueService;
import com.autoviral.worker.service.series.SeriesConfigService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 게시 트리거
 *
 * 대상 계정마다 PENDING Post 와 PUBLISH 작업을 하나씩 만든다. 계정별 게시는 서로 독립적으로 재시도된다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PublishService {

    private final EpisodeMapper episodeMapper;
    private final AssetMapper assetMapper;
    private final PostMapper postMapper;
    private final SocialAccountMapper socialAccountMapper;
    private final SeriesConfigService seriesConfigService;
    private final TaskQueueService taskQueueService;

    /**
     * 사용자 "지금 게시"
     */
    @Transactional
    public PublishDto.TriggerResult publishNow(Long episodeId) {
        Episode episode = episodeMapper.findById(episodeId)
                .orElseThrow(() -> new ApiException(ErrorCode.EPISODE_NOT_FOUND, "Episode not found"));
        if (episode.getVideoAssetId() == null || episode.getPreviewUrl() == null || episode.getPreviewUrl().isBlank()) {
            throw new ApiException(ErrorCode.EPISODE_NO_VIDEO,
                    "Episode has no video; generate script, then media, then render first");
        }
        Series series = seriesConfigService.getSeries(episode.getSeriesId());
        List<SocialAccount> accounts = resolveAccounts(seriesConfigService.getConfig(series));
        if (accounts.isEmpty()) {
            log.info("[Publish] episodeId={} has no connected accounts", episodeId);
            return PublishDto.TriggerResult.builder()
                    .success(false)
                    .message("No connected accounts to publish to")
                    .postIds(List.of())
                    .build();
        }

        List<Long> postIds = new ArrayList<>();
        for (SocialAccount account : accounts) {
            Post post = Post.builder()
                    .episodeId(episodeId)
                    .socialAccountId(account.getSocialAccountId())
                    .status(PostStatus.PENDING)
                    .build();
            postMapper.insert(post);
            taskQueueService.enqueue(PipelineStage.PUBLISH, post.getPostId());
            postIds.add(post.getPostId());
        }
        log.info("[Publish] episodeId={} enqueued {} post(s): {}", episodeId, postIds.size(), postIds);
        return PublishDto.TriggerResult.builder()
                .success(true)
                .message("Publishing to " + postIds.size() + " account(s)")
                .postIds(postIds)
                .build();
    }

    /**
     * 렌더 완료 후 호출. 시리즈 자동 게시가 꺼져 있으면 아무것도 하지 않는다.
     */
    @Transactional
    public void autoPublish(Long episodeId) {
        Episode episode = episodeMapper.findById(episodeId)
                .orElseThrow(() -> new ApiException(ErrorCode.EPISODE_NOT_FOUND, "Episode not found"));
        Series series = seriesConfigService.getSeries(episode.getSeriesId());
        if (!Boolean.TRUE.equals(series.getAutoPostEnabled())) {
            log.debug("[Publish] episodeId={} auto-post disabled for seriesId={}", episodeId, series.getSeriesId());
            return;
        }
        if (alreadyFannedOut(episode)) {
            log.info("[Publish] episodeId={} videoAssetId={} already has posts, skipping auto-publish",
                    episodeId, episode.getVideoAssetId());
            return;
        }
        PublishDto.TriggerResult result = publishNow(episodeId);
        log.info("[Publish] episodeId={} auto-publish success={} message={}", episodeId, result.isSuccess(), result.getMessage());
    }

    /**
     * 현재 영상이 만들어진 뒤에 생성된 Post 가 있으면 이미 게시 트리거가 돈 것
     */
    boolean alreadyFannedOut(Episode episode) {
        if (episode.getVideoAssetId() == null) {
            return false;
        }
        LocalDateTime renderedAt = assetMapper.findById(episode.getVideoAssetId())
                .map(Asset::getCreatedAt)
                .orElse(null);
        if (renderedAt == null) {
            return false;
        }
        return postMapper.findByEpisodeId(episode.getEpisodeId()).stream()
                .anyMatch(p -> p.getCreatedAt() != null && !p.getCreatedAt().isBefore(renderedAt));
    }

    /**
     * 시리즈에 지정된 계정 중 워크스페이스에서 CONNECTED 인 것. 지정이 없으면 워크스페이스의 CONNECTED 전부.
     */
    List<SocialAccount> resolveAccounts(SeriesDto.Config config) {
        List<SocialAccount> connected = socialAccountMapper.findConnectedByWorkspaceId(config.getWorkspaceId());
        List<Long> configured = config.getConnectedSocialAccountIds();
        if (configured == null || configured.isEmpty()) {
            return connected;
        }
        Set<Long> wanted = new HashSet<>(configured);
        return connected.stream()
                .filter(account -> wanted.contains(account.getSocialAccountId()))
                .collect(Collectors.toList());
    }
}
