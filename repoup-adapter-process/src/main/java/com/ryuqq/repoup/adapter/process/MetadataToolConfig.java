package com.ryuqq.repoup.adapter.process;

import java.time.Duration;

/**
 * 메타데이터 생성 도구 설정.
 *
 * @author Repoup Team
 * @since 1.0.0
 * @param createrepoCommand RPM 저장소용 createrepo_c 실행 파일
 * @param checksumType createrepo_c {@code --checksum} 값 (sha256, sha512 ...)
 * @param compressionType createrepo_c {@code --general-compress-type} 값 (gz, xz, zstd ...)
 * @param scanPackagesCommand Debian 저장소용 dpkg-scanpackages 실행 파일
 * @param timeout 생성 명령 하나의 최대 실행 시간
 */
public record MetadataToolConfig(
    String createrepoCommand,
    String checksumType,
    String compressionType,
    String scanPackagesCommand,
    Duration timeout
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: createrepo_c, sha256, gz, dpkg-scanpackages, timeout=5m</p>
     */
    public MetadataToolConfig() {
        this("createrepo_c", "sha256", "gz", "dpkg-scanpackages", Duration.ofMinutes(5));
    }

    public MetadataToolConfig {
        if (createrepoCommand == null || createrepoCommand.isBlank()) {
            throw new IllegalArgumentException("createrepoCommand cannot be null or blank");
        }
        if (checksumType == null || checksumType.isBlank()) {
            throw new IllegalArgumentException("checksumType cannot be null or blank");
        }
        if (compressionType == null || compressionType.isBlank()) {
            throw new IllegalArgumentException("compressionType cannot be null or blank");
        }
        if (scanPackagesCommand == null || scanPackagesCommand.isBlank()) {
            throw new IllegalArgumentException("scanPackagesCommand cannot be null or blank");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
    }

    public MetadataToolConfig withCompressionType(String compressionType) {
        return new MetadataToolConfig(createrepoCommand, checksumType, compressionType, scanPackagesCommand, timeout);
    }

    public MetadataToolConfig withTimeout(Duration timeout) {
        return new MetadataToolConfig(createrepoCommand, checksumType, compressionType, scanPackagesCommand, timeout);
    }
}
