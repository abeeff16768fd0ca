package com.autoviral.worker.util;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 외부 프로세스(ffmpeg, ffprobe) 실행 유틸리티
 * - 출력은 최대 {@value #MAX_OUTPUT_LINES}줄까지만 보관
 * - 타임아웃 초과 시 강제 종료
 * - 실행 파일이 없으면 {@link ToolNotFoundException}
 */
@Slf4j
public final class ProcessExecutor {

    private static final int MAX_OUTPUT_LINES = 1000;

    private ProcessExecutor() {
    }

    @Getter
    @RequiredArgsConstructor
    public static class Result {
        private final int exitCode;
        private final String output;

        public boolean isSuccess() {
            return exitCode == 0;
        }

        /**
         * 오류 메시지에 붙일 출력 끝부분 (ffmpeg 는 마지막 줄에 원인을 남긴다)
         */
        public String tail(int maxChars) {
            if (output.length() <= maxChars) {
                return output.trim();
            }
            return output.substring(output.length() - maxChars).trim();
        }
    }

    /**
     * 실행 파일 자체를 찾지 못한 경우
     */
    @Getter
    public static class ToolNotFoundException extends IOException {
        private final String tool;

        public ToolNotFoundException(String tool, Throwable cause) {
            super(tool + " not found", cause);
            this.tool = tool;
        }
    }

    public static Result execute(List<String> command, String taskName, long timeout, TimeUnit unit)
            throws IOException, InterruptedException, TimeoutException {

        String joined = String.join(" ", command);
        log.debug("[ProcessExecutor] Starting {}: {}", taskName, joined.substring(0, Math.min(200, joined.length())));

        PathValidator.validateCommandArgs(command);

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(true);

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            // Linux/macOS: "error=2, No such file or directory"
            String message = String.valueOf(e.getMessage());
            if (message.contains("error=2") || message.contains("No such file")) {
                throw new ToolNotFoundException(command.get(0), e);
            }
            throw e;
        }

        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            int lineCount = 0;
            while ((line = reader.readLine()) != null) {
                if (lineCount < MAX_OUTPUT_LINES) {
                    output.append(line).append("\n");
                }
                lineCount++;
            }
        }

        if (!process.waitFor(timeout, unit)) {
            process.destroyForcibly();
            log.error("[ProcessExecutor] {} TIMEOUT after {} {}", taskName, timeout, unit);
            throw new TimeoutException("Process timeout: " + taskName + " (" + timeout + " " + unit + ")");
        }

        int exitCode = process.exitValue();
        if (exitCode != 0) {
            log.warn("[ProcessExecutor] {} failed with exit code {}", taskName, exitCode);
        } else {
            log.debug("[ProcessExecutor] {} completed", taskName);
        }
        return new Result(exitCode, output.toString());
    }

    /**
     * 실행 후 종료 코드가 0이 아니면 IOException
     */
    public static Result executeOrThrow(List<String> command, String taskName, long timeout, TimeUnit unit)
            throws IOException, InterruptedException, TimeoutException {
        Result result = execute(command, taskName, timeout, unit);
        if (!result.isSuccess()) {
            throw new IOException(taskName + " failed with exit code " + result.getExitCode()
                    + ": " + result.tail(300));
        }
        return result;
    }
}
