package com.autoviral.worker.service.episode;

import com.autoviral.common.enums.EpisodeStatus;
import com.autoviral.common.enums.PipelineStage;
import com.autoviral.common.exception.ApiException;
import com.autoviral.common.exception.ErrorCode;
import com.autoviral.worker.entity.Episode;
import com.autoviral.worker.service.pipeline.TaskQueueService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("EpisodeCommandService Tests")
class EpisodeCommandServiceTest {

    private EpisodeUpdateService episodeUpdateService;
    private TaskQueueService taskQueueService;
    private EpisodeCommandService service;

    @BeforeEach
    void setUp() {
        episodeUpdateService = mock(EpisodeUpdateService.class);
        taskQueueService = mock(TaskQueueService.class);
        service = new EpisodeCommandService(episodeUpdateService, taskQueueService);
    }

    private void givenEpisode(EpisodeStatus status, Long scriptId) {
        when(episodeUpdateService.getEpisode(7L)).thenReturn(
                Episode.builder().episodeId(7L).status(status).scriptId(scriptId).build());
    }

    @Test
    @DisplayName("Regenerating a failed episode queues a script task")
    void testRegenerateScript() {
        givenEpisode(EpisodeStatus.FAILED, 3L);
        when(taskQueueService.enqueue(PipelineStage.SCRIPT, 7L)).thenReturn(99L);

        assertEquals(99L, service.regenerateScript(7L));
    }

    @Test
    @DisplayName("Regenerating while generating is rejected")
    void testRegenerateScript_InvalidStatus() {
        givenEpisode(EpisodeStatus.GENERATING, null);

        ApiException e = assertThrows(ApiException.class, () -> service.regenerateScript(7L));

        assertEquals(ErrorCode.EPISODE_INVALID_STATUS, e.getErrorCode());
        verifyNoInteractions(taskQueueService);
    }

    @Test
    @DisplayName("Media needs a script first")
    void testGenerateMedia_NoScript() {
        givenEpisode(EpisodeStatus.READY_FOR_REVIEW, null);

        ApiException e = assertThrows(ApiException.class, () -> service.generateMedia(7L));

        assertEquals(ErrorCode.SCRIPT_NOT_FOUND, e.getErrorCode());
        assertEquals("Generate script first", e.getMessage());
    }

    @Test
    @DisplayName("Media from review queues a media task")
    void testGenerateMedia() {
        givenEpisode(EpisodeStatus.READY_FOR_REVIEW, 3L);
        when(taskQueueService.enqueue(PipelineStage.MEDIA, 7L)).thenReturn(100L);

        assertEquals(100L, service.generateMedia(7L));
    }

    @Test
    @DisplayName("Approve fails when the episode changed concurrently")
    void testApprove_Concurrent() {
        givenEpisode(EpisodeStatus.READY_FOR_REVIEW, 3L);
        when(episodeUpdateService.transition(any(), any(), any())).thenReturn(false);

        ApiException e = assertThrows(ApiException.class, () -> service.approve(7L));

        assertEquals(ErrorCode.EPISODE_INVALID_STATUS, e.getErrorCode());
    }

    @Test
    @DisplayName("Approve moves a reviewed episode to approved")
    void testApprove() {
        givenEpisode(EpisodeStatus.READY_FOR_REVIEW, 3L);
        when(episodeUpdateService.transition(7L, EpisodeStatus.READY_FOR_REVIEW, EpisodeStatus.APPROVED))
                .thenReturn(true);

        assertDoesNotThrow(() -> service.approve(7L));
    }
}
