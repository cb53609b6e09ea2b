package com.ryuqq.repoup.application.engine;

import com.ryuqq.repoup.core.model.ContentHash;
import com.ryuqq.repoup.core.model.PackageArtifact;
import com.ryuqq.repoup.core.model.PackageFormat;
import com.ryuqq.repoup.core.model.RepositoryPrefix;

import java.util.List;

/**
 * 저장소 업데이트 엔진 (호출 진입점).
 *
 * <p>CLI, 이벤트 핸들러 등 엔트리포인트가 함수 호출로 사용하는 포트입니다.
 * 모든 연산은 입력 패키지/저장소 단위의 {@link UpdateReport}를 반환하며,
 * 저장소 단위 실패는 예외가 아니라 보고서 항목으로 표현됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * UpdateReport report = engine.add(List.of(PackageArtifact.of("foo-1.0-1.x86_64.rpm", bytes)),
 *     UpdateOptions.defaults());
 *
 * if (report.hasFailures()) {
 *     report.failures().forEach(entry -&gt; log.error("{}", entry));
 * }
 * System.exit(report.exitStatus());
 * </pre>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public interface RepositoryUpdateEngine {

    /**
     * 패키지 추가.
     *
     * <p>각 패키지의 대상 저장소를 결정하고, 저장소별로 lease를 획득한 뒤
     * 패키지 저장 → 메타데이터 생성 → 서명 → 매니페스트 게시 순서로 처리합니다.</p>
     *
     * @param artifacts 추가할 패키지 아티팩트
     * @param options 호출 옵션
     * @return 패키지별 결과 보고서
     * @throws IllegalArgumentException artifacts 또는 options가 null인 경우
     */
    UpdateReport add(List<PackageArtifact> artifacts, UpdateOptions options);

    /**
     * 스토리지에 이미 업로드된 오브젝트를 패키지로 추가.
     *
     * <p>{@link UpdateOptions#removeSource()}가 설정되면 게시 성공 후 원본 오브젝트를 삭제합니다.</p>
     *
     * @param sourceKeys 업로드된 오브젝트 키
     * @param options 호출 옵션
     * @return 오브젝트별 결과 보고서
     */
    UpdateReport addStored(List<String> sourceKeys, UpdateOptions options);

    /**
     * 콘텐츠 해시로 패키지 제거.
     *
     * <p>소유 저장소는 스토리지의 매니페스트를 탐색하여 결정합니다.
     * 어느 저장소에도 없는 해시는 PACKAGE_NOT_FOUND로 보고됩니다.</p>
     *
     * @param contentHashes 제거할 패키지 해시
     * @param options 호출 옵션
     * @return 해시별 결과 보고서
     */
    UpdateReport remove(List<ContentHash> contentHashes, UpdateOptions options);

    /**
     * 빈 저장소 초기화.
     *
     * <p>이미 매니페스트가 있는 저장소는 변경하지 않고 UNCHANGED로 보고합니다.</p>
     *
     * @param prefix 저장소 prefix
     * @param format 패키지 포맷
     * @return 단일 항목 보고서
     */
    UpdateReport init(RepositoryPrefix prefix, PackageFormat format);

    /**
     * 대상 저장소 결정만 수행 (dry-run).
     *
     * <p>스토리지를 변경하지 않으며, NoMatchingRepository는 항목 단위로만 보고됩니다.</p>
     *
     * @param artifacts 대상 패키지
     * @return 패키지별 결정 결과
     */
    UpdateReport resolve(List<PackageArtifact> artifacts);
}
