/**
 * 서명 어댑터.
 *
 * <p>패키지는 스테이징 전에 서명되고 (서명이 저장되는 아티팩트의 일부),
 * 매니페스트는 메타데이터 생성 후 게시 전에 서명됩니다.</p>
 *
 * <h2>키링</h2>
 * <p>{@link com.ryuqq.repoup.adapter.runner.signing.KeyringGuard}가 키 import/사용/제거를
 * 프로세스 단위로 직렬화합니다. 검증에 시스템 키링 변경(권한 상승)이 필요한지는
 * 서명 도구 설정의 명시적 플래그로만 결정됩니다.</p>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
package com.ryuqq.repoup.adapter.runner.signing;
