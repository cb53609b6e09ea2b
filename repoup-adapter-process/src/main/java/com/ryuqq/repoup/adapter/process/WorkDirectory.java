package com.ryuqq.repoup.adapter.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * 외부 도구용 임시 작업 디렉터리. 닫으면 하위 트리 전체를 삭제합니다.
 *
 * @author Repoup Team
 * @since 1.0.0
 */
final class WorkDirectory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkDirectory.class);

    private final Path root;

    private WorkDirectory(Path root) {
        this.root = root;
    }

    /**
     * 소유자만 접근 가능한 임시 디렉터리 생성.
     *
     * @param prefix 디렉터리 이름 prefix
     * @return WorkDirectory
     * @throws UncheckedIOException 생성 실패 시
     */
    static WorkDirectory create(String prefix) {
        try {
            if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
                return new WorkDirectory(Files.createTempDirectory(prefix,
                    PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rwx------"))));
            }
            return new WorkDirectory(Files.createTempDirectory(prefix));
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to create a temporary directory", e);
        }
    }

    Path root() {
        return root;
    }

    Path resolve(String relativePath) {
        Path resolved = root.resolve(relativePath).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Path escapes the work directory: " + relativePath);
        }
        return resolved;
    }

    Path write(String relativePath, byte[] content) {
        Path target = resolve(relativePath);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, content);
            return target;
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to write " + target, e);
        }
    }

    byte[] read(String relativePath) {
        Path source = resolve(relativePath);
        try {
            return Files.readAllBytes(source);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + source, e);
        }
    }

    /**
     * 디렉터리 직속 일반 파일 목록 (이름 순).
     */
    List<Path> listFiles(String relativeDirectory) {
        Path directory = resolve(relativeDirectory);
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(Files::isRegularFile).sorted().toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to list " + directory, e);
        }
    }

    @Override
    public void close() {
        try (Stream<Path> paths = Files.walk(root)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        } catch (IOException | UncheckedIOException e) {
            log.warn("Failed to delete work directory {}: {}", root, e.getMessage());
        }
    }
}
