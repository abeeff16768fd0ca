package com.autoviral.worker.util;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * 작업 단위 임시 디렉토리 (PathValidator.WORK_ROOT 하위). close() 시 통째로 삭제.
 */
@Slf4j
public class WorkDirectory implements AutoCloseable {

    @Getter
    private final Path path;

    private WorkDirectory(Path path) {
        this.path = path;
    }

    public static WorkDirectory create(String prefix) {
        Path dir = PathValidator.WORK_ROOT.resolve(prefix + "-" + UUID.randomUUID().toString().substring(0, 8));
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create work directory " + dir, e);
        }
        return new WorkDirectory(dir);
    }

    public Path resolve(String fileName) {
        return path.resolve(fileName);
    }

    public Path write(String fileName, byte[] data) {
        Path file = resolve(fileName);
        try {
            Files.write(file, data);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
        return file;
    }

    @Override
    public void close() {
        if (!Files.exists(path)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(path)) {
            walk.sorted(Comparator.reverseOrder()).forEach(WorkDirectory::deleteQuietly);
        } catch (IOException e) {
            log.warn("[WorkDirectory] Failed to clean up {}: {}", path, e.getMessage());
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("[WorkDirectory] Failed to delete {}: {}", file, e.getMessage());
        }
    }
}
