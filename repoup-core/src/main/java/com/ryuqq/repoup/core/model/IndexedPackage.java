package com.ryuqq.repoup.core.model;

/**
 * 저장소 인덱스에 등록된 패키지.
 *
 * @param descriptor 패키지 식별 정보
 * @param objectKey 서명된 아티팩트가 저장된 스토리지 키
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public record IndexedPackage(
    PackageDescriptor descriptor,
    String objectKey
) {

    public IndexedPackage {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor cannot be null");
        }
        if (objectKey == null || objectKey.isBlank()) {
            throw new IllegalArgumentException("objectKey cannot be null or blank");
        }
    }

    public ContentHash contentHash() {
        return descriptor.contentHash();
    }
}
