/**
 * Repoup Application Layer - 저장소 업데이트 호출 API.
 *
 * <h2>핵심 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.repoup.application.engine.RepositoryUpdateEngine} - add / addStored / remove / init / resolve</li>
 *   <li>{@link com.ryuqq.repoup.application.engine.UpdateOptions} - 호출 옵션</li>
 *   <li>{@link com.ryuqq.repoup.application.engine.UpdateReport} - 항목별 결과 보고서</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 adapter-runner 모듈에 위치</li>
 *   <li><strong>부분 성공 보존:</strong> 저장소 단위 실패는 보고서 항목으로 표현</li>
 * </ul>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
package com.ryuqq.repoup.application.engine;
