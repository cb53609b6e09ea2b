package com.ryuqq.repoup.adapter.process;

import java.time.Duration;

/**
 * gpg / rpm 서명 도구 설정.
 *
 * @author Repoup Team
 * @since 1.0.0
 * @param gpgCommand GnuPG v2 실행 파일
 * @param gpgconfCommand gpgconf 실행 파일 (세션 종료 시 gpg-agent 종료)
 * @param presetPassphraseCommand gpg-preset-passphrase 실행 파일 (passphrase가 있는 키에만 사용)
 * @param rpmCommand rpm 실행 파일
 * @param verifyRequiresElevation true이면 rpm 키링 변경(--import, --erase)을 sudo로 실행
 * @param clearKeyAfterUse true이면 세션 종료 시 import한 키를 키링에서 제거
 * @param timeout 외부 명령 하나의 최대 실행 시간
 */
public record GpgToolConfig(
    String gpgCommand,
    String gpgconfCommand,
    String presetPassphraseCommand,
    String rpmCommand,
    boolean verifyRequiresElevation,
    boolean clearKeyAfterUse,
    Duration timeout
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: gpg, gpgconf, /usr/libexec/gpg-preset-passphrase, rpm, elevation 없음, 키 제거, timeout=2m</p>
     */
    public GpgToolConfig() {
        this("gpg", "gpgconf", "/usr/libexec/gpg-preset-passphrase", "rpm", false, true, Duration.ofMinutes(2));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public GpgToolConfig {
        requireCommand(gpgCommand, "gpgCommand");
        requireCommand(gpgconfCommand, "gpgconfCommand");
        requireCommand(presetPassphraseCommand, "presetPassphraseCommand");
        requireCommand(rpmCommand, "rpmCommand");
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
    }

    private static void requireCommand(String command, String name) {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
    }

    public GpgToolConfig withGpgCommand(String gpgCommand) {
        return new GpgToolConfig(gpgCommand, gpgconfCommand, presetPassphraseCommand, rpmCommand,
            verifyRequiresElevation, clearKeyAfterUse, timeout);
    }

    public GpgToolConfig withRpmCommand(String rpmCommand) {
        return new GpgToolConfig(gpgCommand, gpgconfCommand, presetPassphraseCommand, rpmCommand,
            verifyRequiresElevation, clearKeyAfterUse, timeout);
    }

    public GpgToolConfig withVerifyRequiresElevation(boolean verifyRequiresElevation) {
        return new GpgToolConfig(gpgCommand, gpgconfCommand, presetPassphraseCommand, rpmCommand,
            verifyRequiresElevation, clearKeyAfterUse, timeout);
    }

    public GpgToolConfig withClearKeyAfterUse(boolean clearKeyAfterUse) {
        return new GpgToolConfig(gpgCommand, gpgconfCommand, presetPassphraseCommand, rpmCommand,
            verifyRequiresElevation, clearKeyAfterUse, timeout);
    }

    public GpgToolConfig withTimeout(Duration timeout) {
        return new GpgToolConfig(gpgCommand, gpgconfCommand, presetPassphraseCommand, rpmCommand,
            verifyRequiresElevation, clearKeyAfterUse, timeout);
    }
}
