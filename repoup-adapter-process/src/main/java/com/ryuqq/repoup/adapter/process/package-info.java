/**
 * 외부 바이너리 어댑터.
 *
 * <p>서명과 메타데이터 생성은 gpg, rpm, createrepo_c 같은 외부 도구에 위임합니다.
 * 모든 호출은 {@link com.ryuqq.repoup.adapter.process.ProcessRunner}를 거치므로
 * 테스트에서는 실행 결과를 대체할 수 있습니다.</p>
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.repoup.adapter.process.SystemProcessRunner} - ProcessBuilder + timeout</li>
 *   <li>{@link com.ryuqq.repoup.adapter.process.GpgSigningTool} - 세션별 GNUPGHOME, rpm --addsign, gpg --detach-sign</li>
 *   <li>{@link com.ryuqq.repoup.adapter.process.CommandMetadataGenerator} - createrepo_c / dpkg-scanpackages</li>
 * </ul>
 *
 * <h2>오류 변환</h2>
 * <p>0이 아닌 종료 코드와 실행 실패는 SigningFailedException 또는 MetadataBuildFailedException으로,
 * timeout은 UpdateTimeoutException으로 보고됩니다.</p>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
package com.ryuqq.repoup.adapter.process;
