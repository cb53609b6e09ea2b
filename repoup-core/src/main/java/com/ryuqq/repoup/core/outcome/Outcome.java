package com.ryuqq.repoup.core.outcome;

/**
 * 패키지/저장소 단위 처리 결과.
 *
 * <p>Outcome은 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 처리 완료 (추가, 삭제, 변경 없음, 초기화, 해석)</li>
 *   <li>{@link Fail}: 실패 (오류 코드 포함)</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스를 컴파일 타임에 검증합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * if (outcome instanceof Fail fail) {
 *     log.error("{} failed: {}", subject, fail.errorCode());
 * }
 * </pre>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Ok, Fail {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }
}
