package com.ryuqq.repoup.core.model;

import java.util.Locale;

/**
 * 저장소 패키지 포맷.
 *
 * <p>포맷은 파일 확장자로 식별되며, 저장소 레이아웃의 아티팩트 키 확장자로도 사용됩니다.</p>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public enum PackageFormat {

    /**
     * RPM 패키지 (*.rpm).
     */
    RPM("rpm"),

    /**
     * Debian 패키지 (*.deb).
     */
    DEB("deb");

    private final String extension;

    PackageFormat(String extension) {
        this.extension = extension;
    }

    /**
     * 파일 확장자 조회 (점 없음).
     *
     * @return 확장자 (예: "rpm")
     */
    public String extension() {
        return extension;
    }

    /**
     * 포맷 이름(대소문자 무관) 또는 확장자로 포맷 조회.
     *
     * @param value 포맷 이름 또는 확장자 (예: "rpm", "RPM")
     * @return PackageFormat
     * @throws IllegalArgumentException 지원하지 않는 포맷인 경우
     */
    public static PackageFormat of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("format cannot be null or blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (PackageFormat format : values()) {
            if (format.extension.equals(normalized)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unsupported package format: " + value);
    }

    /**
     * 파일 이름의 확장자가 이 포맷인지 확인.
     *
     * @param filename 파일 이름
     * @return 확장자가 일치하면 true
     */
    public boolean matchesFilename(String filename) {
        return filename != null && filename.toLowerCase(Locale.ROOT).endsWith("." + extension);
    }

    @Override
    public String toString() {
        return extension;
    }
}
