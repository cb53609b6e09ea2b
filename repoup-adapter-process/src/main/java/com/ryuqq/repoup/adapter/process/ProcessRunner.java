package com.ryuqq.repoup.adapter.process;

/**
 * 외부 프로세스 실행 포트.
 *
 * <p>gpg, rpm, createrepo_c 같은 외부 바이너리 호출을 한 곳으로 모아 테스트에서 대체할 수 있게 합니다.
 * 0이 아닌 종료 코드는 예외가 아니라 {@link ProcessResult}로 반환됩니다.</p>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ProcessRunner {

    /**
     * 명령을 실행하고 종료를 기다립니다.
     *
     * @param command 실행할 명령
     * @return 실행 결과
     * @throws java.io.UncheckedIOException 프로세스를 시작할 수 없는 경우 (실행 파일 없음 등)
     * @throws com.ryuqq.repoup.core.error.UpdateTimeoutException timeout 초과 또는 대기 중 인터럽트
     */
    ProcessResult run(ProcessCommand command);
}
