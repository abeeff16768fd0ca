package com.autoviral.worker.util;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * 렌더링 작업 경로 검증
 * ffmpeg 에 넘기는 절대경로는 작업 디렉토리 하위만 허용한다.
 */
@Slf4j
public final class PathValidator {

    public static final Path WORK_ROOT = Paths.get(System.getProperty("java.io.tmpdir"), "autoviral")
            .toAbsolutePath().normalize();

    private static final String[] FORBIDDEN_PATTERNS = {
            "..", "//", "\0", "\n", "\r", ";", "|", "&", "$(", "`"
    };

    private PathValidator() {
    }

    public static boolean isSafe(String path) {
        if (path == null || path.isBlank()) {
            return false;
        }
        for (String pattern : FORBIDDEN_PATTERNS) {
            if (path.contains(pattern)) {
                log.warn("[PathValidator] Forbidden pattern '{}' in path: {}", pattern, truncate(path));
                return false;
            }
        }
        return true;
    }

    /**
     * 심볼릭 링크를 해석한 실제 경로까지 작업 디렉토리 하위인지 확인
     */
    public static boolean isWithinWorkRoot(Path path) {
        if (path == null) {
            return false;
        }
        Path normalized = path.toAbsolutePath().normalize();
        if (!normalized.startsWith(WORK_ROOT)) {
            log.warn("[PathValidator] Path outside work root: {}", truncate(normalized.toString()));
            return false;
        }
        if (Files.exists(normalized)) {
            try {
                Path root = Files.exists(WORK_ROOT) ? WORK_ROOT.toRealPath() : WORK_ROOT;
                if (!normalized.toRealPath().startsWith(root)) {
                    log.warn("[PathValidator] Symlink traversal detected: {}", truncate(normalized.toString()));
                    return false;
                }
            } catch (IOException e) {
                log.warn("[PathValidator] Failed to resolve real path: {}", truncate(normalized.toString()));
                return false;
            }
        }
        return true;
    }

    public static Path validateAndGet(String pathStr) {
        if (!isSafe(pathStr)) {
            throw new SecurityException("Unsafe path detected: " + truncate(pathStr));
        }
        Path path = Paths.get(pathStr).toAbsolutePath().normalize();
        if (!isWithinWorkRoot(path)) {
            throw new SecurityException("Path outside work directory: " + truncate(pathStr));
        }
        return path;
    }

    /**
     * ffmpeg/ffprobe 인자 검증
     * 옵션(-로 시작)과 필터 식은 통과, 절대경로는 작업 디렉토리 하위만 허용
     */
    public static void validateCommandArgs(List<String> args) {
        if (args == null) {
            return;
        }
        for (int i = 1; i < args.size(); i++) {
            String arg = args.get(i);
            if (arg == null || arg.isEmpty() || arg.startsWith("-")) {
                continue;
            }
            if (arg.contains("..")) {
                log.error("[PathValidator] 상대경로 탐색 시도 차단: {}", truncate(arg));
                throw new SecurityException("상대경로 접근 거부: " + truncate(arg));
            }
            if (arg.startsWith("/") && !arg.equals("/dev/null")) {
                validateAndGet(arg);
            }
        }
    }

    private static String truncate(String str) {
        if (str == null) {
            return "null";
        }
        return str.length() <= 80 ? str : str.substring(0, 80) + "...";
    }
}
