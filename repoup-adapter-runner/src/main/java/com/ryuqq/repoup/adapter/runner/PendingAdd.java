package com.ryuqq.repoup.adapter.runner;

import com.ryuqq.repoup.core.model.PackageDescriptor;

import java.util.List;

/**
 * RESOLVING을 통과한 추가 요청.
 *
 * @param position 리포트 내 위치
 * @param subject 리포트 subject (파일 이름 또는 소스 키)
 * @param descriptor 추출된 descriptor
 * @param content 서명 전 패키지 바이트
 * @param warnings DescriptorMismatch 경고
 * @param sourceKey addStored의 소스 키 (add이면 null)
 */
record PendingAdd(
    int position,
    String subject,
    PackageDescriptor descriptor,
    byte[] content,
    List<String> warnings,
    String sourceKey
) {

    PendingAdd {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor cannot be null");
        }
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    String filename() {
        int slash = subject.lastIndexOf('/');
        return slash >= 0 ? subject.substring(slash + 1) : subject;
    }
}
