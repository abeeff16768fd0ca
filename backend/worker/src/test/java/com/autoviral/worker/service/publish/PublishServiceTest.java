package com.autoviral.worker.service.publish;

import com.autoviral.common.enums.PipelineStage;
import com.autoviral.common.enums.Platform;
import com.autoviral.common.enums.PostStatus;
import com.autoviral.common.enums.SocialAccountStatus;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("PublishService Tests")
class PublishServiceTest {

    private EpisodeMapper episodeMapper;
    private AssetMapper assetMapper;
    private PostMapper postMapper;
    private SocialAccountMapper socialAccountMapper;
    private SeriesConfigService seriesConfigService;
    private TaskQueueService taskQueueService;
    private PublishService service;

    private final Series series = Series.builder().seriesId(1L).workspaceId(10L).autoPostEnabled(true).build();

    @BeforeEach
    void setUp() {
        episodeMapper = mock(EpisodeMapper.class);
        assetMapper = mock(AssetMapper.class);
        postMapper = mock(PostMapper.class);
        socialAccountMapper = mock(SocialAccountMapper.class);
        seriesConfigService = mock(SeriesConfigService.class);
        taskQueueService = mock(TaskQueueService.class);
        service = new PublishService(episodeMapper, assetMapper, postMapper, socialAccountMapper, seriesConfigService, taskQueueService);

        when(episodeMapper.findById(7L)).thenReturn(Optional.of(Episode.builder()
                .episodeId(7L).seriesId(1L).videoAssetId(500L).previewUrl("https://cdn/video.mp4").build()));
        when(seriesConfigService.getSeries(1L)).thenReturn(series);
        when(socialAccountMapper.findConnectedByWorkspaceId(10L)).thenReturn(List.of(
                account(3L, Platform.TIKTOK), account(4L, Platform.YOUTUBE), account(5L, Platform.INSTAGRAM)));

        AtomicLong ids = new AtomicLong(100);
        doAnswer(invocation -> {
            ReflectionTestUtils.setField(invocation.<Object>getArgument(0), "postId", ids.incrementAndGet());
            return null;
        }).when(postMapper).insert(any(Post.class));
    }

    private static SocialAccount account(Long id, Platform platform) {
        return SocialAccount.builder().socialAccountId(id).workspaceId(10L).platform(platform)
                .status(SocialAccountStatus.CONNECTED).accessToken("enc").build();
    }

    private void givenConfig(List<Long> accountIds) {
        when(seriesConfigService.getConfig(series)).thenReturn(SeriesDto.Config.builder()
                .seriesId(1L).workspaceId(10L).connectedSocialAccountIds(accountIds).build());
    }

    // ==================== Account resolution ====================

    @Test
    @DisplayName("Configured accounts narrow the connected workspace accounts")
    void testResolveAccounts_Configured() {
        List<SocialAccount> accounts = service.resolveAccounts(SeriesDto.Config.builder()
                .workspaceId(10L).connectedSocialAccountIds(List.of(4L, 99L)).build());

        assertEquals(1, accounts.size());
        assertEquals(4L, accounts.get(0).getSocialAccountId());
    }

    @Test
    @DisplayName("No configured accounts means every connected account")
    void testResolveAccounts_All() {
        List<SocialAccount> accounts = service.resolveAccounts(SeriesDto.Config.builder()
                .workspaceId(10L).connectedSocialAccountIds(List.of()).build());

        assertEquals(3, accounts.size());
    }

    // ==================== Publish now ====================

    @Test
    @DisplayName("One pending post and one publish task per account")
    void testPublishNow() {
        givenConfig(List.of(3L, 5L));

        PublishDto.TriggerResult result = service.publishNow(7L);

        assertTrue(result.isSuccess());
        assertEquals("Publishing to 2 account(s)", result.getMessage());
        assertEquals(List.of(101L, 102L), result.getPostIds());
        verify(taskQueueService).enqueue(PipelineStage.PUBLISH, 101L);
        verify(taskQueueService).enqueue(PipelineStage.PUBLISH, 102L);

        ArgumentCaptor<Post> posts = ArgumentCaptor.forClass(Post.class);
        verify(postMapper, times(2)).insert(posts.capture());
        assertEquals(PostStatus.PENDING, posts.getAllValues().get(0).getStatus());
        assertEquals(5L, posts.getAllValues().get(1).getSocialAccountId());
    }

    @Test
    @DisplayName("No accounts is reported without creating posts")
    void testPublishNow_NoAccounts() {
        givenConfig(List.of(42L));

        PublishDto.TriggerResult result = service.publishNow(7L);

        assertFalse(result.isSuccess());
        assertEquals("No connected accounts to publish to", result.getMessage());
        assertTrue(result.getPostIds().isEmpty());
        verify(postMapper, never()).insert(any());
    }

    @Test
    @DisplayName("Episode without a rendered video cannot be published")
    void testPublishNow_NoVideo() {
        when(episodeMapper.findById(8L)).thenReturn(Optional.of(Episode.builder().episodeId(8L).seriesId(1L).build()));

        ApiException e = assertThrows(ApiException.class, () -> service.publishNow(8L));

        assertEquals(ErrorCode.EPISODE_NO_VIDEO, e.getErrorCode());
    }

    // ==================== Auto publish ====================

    @Test
    @DisplayName("Auto publish does nothing when the series has it off")
    void testAutoPublish_Disabled() {
        when(seriesConfigService.getSeries(1L)).thenReturn(Series.builder().seriesId(1L).autoPostEnabled(false).build());

        service.autoPublish(7L);

        verify(postMapper, never()).insert(any());
        verify(taskQueueService, never()).enqueue(any(), any());
    }

    @Test
    @DisplayName("Auto publish fans out when enabled")
    void testAutoPublish_Enabled() {
        givenConfig(List.of());

        service.autoPublish(7L);

        verify(postMapper, times(3)).insert(any());
    }

    @Test
    @DisplayName("Auto publish runs once per rendered video")
    void testAutoPublish_AlreadyFannedOut() {
        givenConfig(List.of());
        LocalDateTime renderedAt = LocalDateTime.of(2024, 3, 8, 12, 0);
        when(assetMapper.findById(500L)).thenReturn(Optional.of(Asset.builder().assetId(500L).createdAt(renderedAt).build()));
        when(postMapper.findByEpisodeId(7L)).thenReturn(List.of(
                Post.builder().postId(90L).episodeId(7L).createdAt(renderedAt.plusSeconds(2)).build()));

        service.autoPublish(7L);

        verify(postMapper, never()).insert(any());
        verify(taskQueueService, never()).enqueue(any(), any());
    }

    @Test
    @DisplayName("Posts of an earlier video do not block publishing a re-render")
    void testAutoPublish_EarlierVideoPosts() {
        givenConfig(List.of());
        LocalDateTime renderedAt = LocalDateTime.of(2024, 3, 8, 12, 0);
        when(assetMapper.findById(500L)).thenReturn(Optional.of(Asset.builder().assetId(500L).createdAt(renderedAt).build()));
        when(postMapper.findByEpisodeId(7L)).thenReturn(List.of(
                Post.builder().postId(60L).episodeId(7L).status(PostStatus.POSTED).createdAt(renderedAt.minusDays(1)).build()));

        service.autoPublish(7L);

        verify(postMapper, times(3)).insert(any());
    }
}
