package com.ryuqq.repoup.core.outcome;

/**
 * 성공 결과.
 *
 * @param action 저장소에 미친 영향
 * @param message 부가 메시지 (선택, null 가능)
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public record Ok(
    EntryAction action,
    String message
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException action이 null인 경우
     */
    public Ok {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        // message는 null 허용
    }

    /**
     * 메시지 없이 성공 결과 생성.
     *
     * @param action 저장소에 미친 영향
     * @return Ok 인스턴스
     */
    public static Ok of(EntryAction action) {
        return new Ok(action, null);
    }
}
