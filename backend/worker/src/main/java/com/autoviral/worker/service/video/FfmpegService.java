package com.autoviral.worker.service.video;

import com.autoviral.common.exception.ApiException;
import com.autoviral.common.exception.ErrorCode;
import com.autoviral.worker.util.ProcessExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * ffmpeg / ffprobe 호출
 *
 * 세그먼트: 1080x1920 캔버스(축소 후 패딩) + zoompan 1.0 → 1.2, 나레이션과 -shortest 로 합성.
 * 이미지가 없으면 검은 color 소스. 최종 영상은 concat demuxer(-c copy).
 */
@Slf4j
@Service
public class FfmpegService {

    public static final int FPS = 30;
    static final double ZOOM_END = 1.2;
    static final String CANVAS = "1080x1920";

    static final String TOOL_MISSING_MESSAGE =
            "ffmpeg not found. Install it on the machine where the worker runs: "
            + "macOS: brew install ffmpeg, Linux: apt install ffmpeg";

    private static final long PROBE_TIMEOUT_SECONDS = 30;
    private static final long RENDER_TIMEOUT_SECONDS = 600;

    private final String ffmpegPath;
    private final String ffprobePath;

    public FfmpegService(@Value("${media.ffmpeg-path:ffmpeg}") String ffmpegPath,
                         @Value("${media.ffprobe-path:ffprobe}") String ffprobePath) {
        this.ffmpegPath = ffmpegPath;
        this.ffprobePath = ffprobePath;
    }

    /**
     * 오디오 길이(초). 측정할 수 없으면 defaultSeconds.
     */
    public double probeDuration(Path audioFile, double defaultSeconds) {
        List<String> command = List.of(
                ffprobePath,
                "-v", "error",
                "-show_entries", "format=duration",
                "-of", "default=noprint_wrappers=1:nokey=1",
                audioFile.toString()
        );
        try {
            ProcessExecutor.Result result = ProcessExecutor.execute(command, "ffprobe", PROBE_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (result.isSuccess()) {
                String output = result.getOutput().trim();
                if (!output.isEmpty()) {
                    return Double.parseDouble(output.lines().findFirst().orElse(output).trim());
                }
            }
            log.warn("[Ffmpeg] ffprobe exit {} for {}, using default {}s", result.getExitCode(), audioFile, defaultSeconds);
        } catch (NumberFormatException | IOException | TimeoutException e) {
            log.warn("[Ffmpeg] Could not probe {} ({}), using default {}s", audioFile, e.getMessage(), defaultSeconds);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Ffmpeg] Interrupted while probing {}, using default {}s", audioFile, defaultSeconds);
        }
        return defaultSeconds;
    }

    public void renderSegment(Path imageFile, Path voiceFile, double durationSeconds, Path output) {
        run(buildSegmentCommand(imageFile, voiceFile, durationSeconds, output), "ffmpeg-segment");
        requireOutput(output);
    }

    /**
     * 세그먼트를 순서대로 이어 붙인다
     */
    public void concat(List<Path> segments, Path output) {
        if (segments.isEmpty()) {
            throw new ApiException(ErrorCode.VIDEO_COMPOSITION_NO_SCENES, "No segments produced");
        }
        Path listFile = output.resolveSibling("concat.txt");
        StringBuilder list = new StringBuilder();
        for (Path segment : segments) {
            list.append("file '").append(segment.toAbsolutePath()).append("'\n");
        }
        try {
            Files.writeString(listFile, list.toString(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ApiException(ErrorCode.VIDEO_COMPOSITION_FAILED, "Failed to write concat list", e);
        }
        run(buildConcatCommand(listFile, output), "ffmpeg-concat");
        requireOutput(output);
    }

    List<String> buildSegmentCommand(Path imageFile, Path voiceFile, double durationSeconds, Path output) {
        List<String> command = new ArrayList<>();
        command.add(ffmpegPath);
        command.add("-y");
        if (imageFile != null && Files.isRegularFile(imageFile)) {
            command.addAll(List.of("-loop", "1", "-i", imageFile.toString(),
                    "-i", voiceFile.toString(), "-shortest",
                    "-vf", kenBurnsFilter(durationSeconds)));
        } else {
            command.addAll(List.of("-f", "lavfi",
                    "-i", "color=c=black:s=" + CANVAS + ":d=" + formatSeconds(Math.max(1.0, durationSeconds)),
                    "-i", voiceFile.toString(), "-shortest"));
        }
        command.addAll(List.of("-c:v", "libx264", "-preset", "fast", "-c:a", "aac", "-b:a", "128k",
                output.toString()));
        return command;
    }

    List<String> buildConcatCommand(Path listFile, Path output) {
        return List.of(ffmpegPath, "-y", "-f", "concat", "-safe", "0", "-i", listFile.toString(),
                "-c", "copy", output.toString());
    }

    /**
     * 프레임당 줌 증가량: 0.2 / (duration × fps), 프레임 수는 최소 1
     */
    static double zoomIncrement(double durationSeconds) {
        int frames = Math.max(1, (int) (durationSeconds * FPS));
        return (ZOOM_END - 1.0) / frames;
    }

    static String kenBurnsFilter(double durationSeconds) {
        String zoom = String.format(Locale.ROOT, "min(zoom+%.6f,%s)", zoomIncrement(durationSeconds), ZOOM_END);
        return "scale=1080:1920:force_original_aspect_ratio=decrease,"
                + "pad=1080:1920:(ow-iw)/2:(oh-ih)/2,"
                + "zoompan=z='" + zoom + "':d=1:s=" + CANVAS + ":fps=" + FPS;
    }

    static String formatSeconds(double seconds) {
        if (seconds == Math.rint(seconds)) {
            return String.valueOf((long) seconds);
        }
        return String.valueOf(seconds);
    }

    private void run(List<String> command, String taskName) {
        try {
            ProcessExecutor.executeOrThrow(command, taskName, RENDER_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (ProcessExecutor.ToolNotFoundException e) {
            throw new ApiException(ErrorCode.MEDIA_TOOL_NOT_FOUND, TOOL_MISSING_MESSAGE, e);
        } catch (IOException | TimeoutException e) {
            throw new ApiException(ErrorCode.VIDEO_COMPOSITION_FAILED, "ffmpeg failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ApiException(ErrorCode.VIDEO_COMPOSITION_FAILED, "ffmpeg interrupted", e);
        }
    }

    private void requireOutput(Path output) {
        if (!Files.isRegularFile(output)) {
            throw new ApiException(ErrorCode.VIDEO_COMPOSITION_FAILED, "ffmpeg did not produce output file " + output.getFileName());
        }
    }
}
