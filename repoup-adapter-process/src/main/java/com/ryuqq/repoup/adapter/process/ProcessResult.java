package com.ryuqq.repoup.adapter.process;

import java.nio.charset.StandardCharsets;

/**
 * 종료된 프로세스의 결과.
 *
 * @param exitCode 종료 코드
 * @param stdout 표준 출력
 * @param stderr 표준 에러
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public record ProcessResult(
    int exitCode,
    byte[] stdout,
    byte[] stderr
) {

    public ProcessResult {
        stdout = stdout == null ? new byte[0] : stdout;
        stderr = stderr == null ? new byte[0] : stderr;
    }

    public static ProcessResult success(String stdout) {
        return new ProcessResult(0, stdout.getBytes(StandardCharsets.UTF_8), new byte[0]);
    }

    public static ProcessResult failure(int exitCode, String stderr) {
        return new ProcessResult(exitCode, new byte[0], stderr.getBytes(StandardCharsets.UTF_8));
    }

    public boolean isSuccess() {
        return exitCode == 0;
    }

    public String stdoutText() {
        return new String(stdout, StandardCharsets.UTF_8);
    }

    public String stderrText() {
        return new String(stderr, StandardCharsets.UTF_8).trim();
    }
}
