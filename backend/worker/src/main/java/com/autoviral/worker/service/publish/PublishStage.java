package com.autoviral.worker.service.publish;

import com.autoviral.common.enums.PipelineStage;
import com.autoviral.common.enums.PostStatus;
import com.autoviral.common.exception.ApiException;
import com.autoviral.common.exception.ErrorCode;
import com.autoviral.worker.config.PipelineConfig;
import com.autoviral.worker.dto.PublishDto;
import com.autoviral.worker.entity.Asset;
import com.autoviral.worker.entity.Episode;
import com.autoviral.worker.entity.Post;
import com.autoviral.worker.entity.Script;
import com.autoviral.worker.entity.SocialAccount;
import com.autoviral.worker.mapper.AssetMapper;
import com.autoviral.worker.mapper.EpisodeMapper;
import com.autoviral.worker.mapper.PostMapper;
import com.autoviral.worker.mapper.ScriptMapper;
import com.autoviral.worker.mapper.SocialAccountMapper;
import com.autoviral.worker.service.pipeline.StageHandler;
import com.autoviral.worker.service.pipeline.StageOutcome;
import com.autoviral.worker.service.storage.StorageService;
import com.autoviral.worker.util.Jsons;
import com.autoviral.worker.util.TokenEncryptor;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * 게시 단계 (입력: postId)
 *
 * PENDING/FAILED → POSTING → POSTED | FAILED {message}.
 * 입력 문제(에피소드/영상/계정/토큰/URL)는 재시도하지 않고, 플랫폼 오류는 FAILED 기록 후 큐 재시도.
 * 에피소드 상태는 바꾸지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PublishStage implements StageHandler {

    private final PostMapper postMapper;
    private final EpisodeMapper episodeMapper;
    private final AssetMapper assetMapper;
    private final ScriptMapper scriptMapper;
    private final SocialAccountMapper socialAccountMapper;
    private final TokenEncryptor tokenEncryptor;
    private final StorageService storageService;
    private final PublisherRegistry publisherRegistry;
    private final PipelineConfig pipelineConfig;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public PipelineStage getStage() {
        return PipelineStage.PUBLISH;
    }

    @Override
    public StageOutcome execute(Long postId, LocalDateTime leaseUntil) {
        Post post = postMapper.findById(postId)
                .orElseThrow(() -> new ApiException(ErrorCode.NOT_FOUND, "Post " + postId + " not found"));
        if (post.getStatus() == PostStatus.POSTED) {
            log.info("[Publish] postId={} already posted, skipping", postId);
            return StageOutcome.SKIPPED;
        }

        // 최종 영상이 없는 에피소드의 게시물은 PENDING 에서 벗어나지 않는다
        Episode episode;
        try {
            episode = requireVideo(post);
        } catch (ApiException e) {
            log.warn("[Publish] postId={} not publishable: {}", postId, e.getMessage());
            postMapper.recordError(postId, errorPayload(e));
            throw e;
        }

        if (postMapper.markPosting(postId) == 0) {
            log.info("[Publish] postId={} already posted, skipping", postId);
            return StageOutcome.SKIPPED;
        }

        try {
            SocialAccount account = socialAccountMapper.findById(post.getSocialAccountId()).orElse(null);
            PublishDto.Request request = prepare(post, episode, account);
            PlatformPublisher publisher = publisherRegistry.find(account.getPlatform())
                    .orElseThrow(() -> new ApiException(ErrorCode.PLATFORM_UNSUPPORTED,
                            "Unsupported platform: " + account.getPlatform()));

            PublishDto.Attempt attempt = publisher.publish(request);
            postMapper.markPosted(postId, attempt.getPlatformPostId(), LocalDateTime.now(clock));
            log.info("[Publish] postId={} posted to {} platformPostId={}", postId, account.getPlatform(), attempt.getPlatformPostId());
            return StageOutcome.COMPLETED;
        } catch (RuntimeException e) {
            log.warn("[Publish] postId={} failed: {}", postId, e.getMessage());
            postMapper.markFailed(postId, errorPayload(e));
            throw e;
        }
    }

    Episode requireVideo(Post post) {
        Episode episode = episodeMapper.findById(post.getEpisodeId())
                .orElseThrow(() -> new ApiException(ErrorCode.EPISODE_NOT_FOUND, "Episode not found"));
        if (episode.getVideoAssetId() == null) {
            throw new ApiException(ErrorCode.EPISODE_NO_VIDEO, "Episode has no video; run render first");
        }
        return episode;
    }

    /**
     * 어댑터 호출 전 검증. 실패는 모두 재시도 불가(4xx) 코드.
     */
    PublishDto.Request prepare(Post post, Episode episode, SocialAccount account) {
        Asset video = assetMapper.findById(episode.getVideoAssetId())
                .orElseThrow(() -> new ApiException(ErrorCode.NOT_FOUND, "Video asset not found"));
        if (account == null) {
            throw new ApiException(ErrorCode.SOCIAL_ACCOUNT_NOT_FOUND, "Social account not found");
        }
        String accessToken = tokenEncryptor.decrypt(account.getAccessToken());
        if (accessToken == null || accessToken.isBlank()) {
            throw new ApiException(ErrorCode.SOCIAL_TOKEN_INVALID, "Missing or invalid access token");
        }
        String videoUrl = StorageService.isPlaceholder(video.getUrl())
                ? null
                : storageService.fetchableUrl(video.getUrl(), pipelineConfig.getVideoUrlTtlSeconds());
        if (StorageService.isPlaceholder(videoUrl)) {
            throw new ApiException(ErrorCode.VIDEO_URL_UNAVAILABLE,
                    "Video URL not available (storage not configured or placeholder)");
        }
        return PublishDto.Request.builder()
                .postId(post.getPostId())
                .accessToken(accessToken)
                .videoUrl(videoUrl)
                .caption(caption(episode))
                .build();
    }

    private String errorPayload(RuntimeException e) {
        return Jsons.write(objectMapper, Map.of("message", String.valueOf(e.getMessage())));
    }

    private String caption(Episode episode) {
        if (episode.getScriptId() == null) {
            return "";
        }
        return scriptMapper.findById(episode.getScriptId())
                .map(Script::getText)
                .orElse("");
    }
}
