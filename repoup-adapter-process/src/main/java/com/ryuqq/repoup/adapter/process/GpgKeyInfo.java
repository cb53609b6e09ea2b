package com.ryuqq.repoup.adapter.process;

import com.ryuqq.repoup.core.error.SigningFailedException;

/**
 * {@code gpg --with-colons --with-keygrip --import-options show-only --import} 출력에서 읽은 키 정보.
 *
 * @param keygrip 비밀 키 keygrip (passphrase preset 대상)
 * @param fingerprint 주 키 fingerprint
 * @param userId 첫 번째 user ID
 *
 * @author Repoup Team
 * @since 1.0.0
 */
record GpgKeyInfo(String keygrip, String fingerprint, String userId) {

    private static final int VALUE_FIELD = 9;

    /**
     * colon 형식 출력 파싱. 각 레코드 타입의 첫 번째 값을 사용합니다.
     *
     * @param colonOutput gpg colon 출력
     * @return 키 정보
     * @throws SigningFailedException grp / fpr / uid 중 하나라도 없는 경우
     */
    static GpgKeyInfo parse(String colonOutput) {
        String keygrip = null;
        String fingerprint = null;
        String userId = null;
        for (String line : colonOutput.split("\\R")) {
            String[] fields = line.split(":", -1);
            if (fields.length <= VALUE_FIELD) {
                continue;
            }
            String value = fields[VALUE_FIELD];
            if (keygrip == null && "grp".equals(fields[0])) {
                keygrip = value;
            } else if (fingerprint == null && "fpr".equals(fields[0])) {
                fingerprint = value;
            } else if (userId == null && "uid".equals(fields[0])) {
                userId = value;
            }
        }
        if (isBlank(keygrip) || isBlank(fingerprint) || isBlank(userId)) {
            throw new SigningFailedException("Unable to find GPG key information (keygrip, fingerprint, user ID)");
        }
        return new GpgKeyInfo(keygrip, fingerprint, userId);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
