/**
 * Runner Adapter Layer - Repository Update Engine 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.repoup.adapter.runner.RepositoryUpdateOrchestrator} - add / addStored / remove / init / resolve</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (RepositoryUpdateOrchestrator)
 *   ↓ implements
 * application (RepositoryUpdateEngine interface)
 *   ↓ depends on
 * core (PackageDescriptor, RepositoryPrefix, Outcome, UpdateState)
 *   ↓ depends on
 * core/spi (ObjectStorage, MetadataGenerator, SigningTool, CacheInvalidator)
 * </pre>
 *
 * <h2>하위 패키지</h2>
 * <ul>
 *   <li>{@code lock} - 조건부 쓰기 기반 lease</li>
 *   <li>{@code storage} - 일시 오류 재시도</li>
 *   <li>{@code metadata} - 매니페스트 / 패키지 인덱스 / 메타데이터 빌드</li>
 *   <li>{@code signing} - 서명 및 키링 임계 구역</li>
 *   <li>{@code json} - 정규화된 JSON 매퍼</li>
 * </ul>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
package com.ryuqq.repoup.adapter.runner;
