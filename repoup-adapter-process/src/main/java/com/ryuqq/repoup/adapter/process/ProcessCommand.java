package com.ryuqq.repoup.adapter.process;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 외부 프로세스 실행 명령.
 *
 * @param arguments 실행 파일과 인자 (비어 있으면 안 됨)
 * @param workingDirectory 작업 디렉터리 (null이면 현재 디렉터리)
 * @param environment 추가 환경 변수
 * @param input 표준 입력으로 전달할 바이트 (nullable)
 * @param timeout 최대 실행 시간
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public record ProcessCommand(
    List<String> arguments,
    Path workingDirectory,
    Map<String, String> environment,
    byte[] input,
    Duration timeout
) {

    public ProcessCommand {
        if (arguments == null || arguments.isEmpty()) {
            throw new IllegalArgumentException("arguments cannot be null or empty");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        arguments = List.copyOf(arguments);
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    public static ProcessCommand of(Duration timeout, List<String> arguments) {
        return new ProcessCommand(arguments, null, Map.of(), null, timeout);
    }

    public String executable() {
        return arguments.get(0);
    }

    public ProcessCommand withWorkingDirectory(Path workingDirectory) {
        return new ProcessCommand(arguments, workingDirectory, environment, input, timeout);
    }

    public ProcessCommand withEnvironment(String name, String value) {
        Map<String, String> merged = new HashMap<>(environment);
        merged.put(name, value);
        return new ProcessCommand(arguments, workingDirectory, merged, input, timeout);
    }

    public ProcessCommand withInput(byte[] input) {
        return new ProcessCommand(arguments, workingDirectory, environment, input, timeout);
    }

    @Override
    public String toString() {
        // 표준 입력에는 passphrase가 들어갈 수 있으므로 출력하지 않음
        return String.join(" ", arguments);
    }
}
