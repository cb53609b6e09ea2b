/**
 * 저장소 메타데이터 읽기/생성.
 *
 * <h2>오브젝트 구성</h2>
 * <pre>
 * &lt;prefix&gt;/metadata/manifest                     ← 유일한 고정 경로, 마지막에 덮어씀
 * &lt;prefix&gt;/metadata/manifest-&lt;sha256&gt;.asc        ← 매니페스트 detached 서명
 * &lt;prefix&gt;/metadata/packages-&lt;sha256&gt;.json       ← 엔진 패키지 인덱스
 * &lt;prefix&gt;/metadata/&lt;component&gt;-&lt;sha256&gt;.&lt;ext&gt;  ← 외부 생성기 컴포넌트
 * </pre>
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.repoup.adapter.runner.metadata.RepositoryCatalog} - 스냅샷 읽기, 저장소 탐색</li>
 *   <li>{@link com.ryuqq.repoup.adapter.runner.metadata.MetadataBuilder} - 전체 인덱스 재계산</li>
 *   <li>{@link com.ryuqq.repoup.adapter.runner.metadata.ManifestCodec},
 *       {@link com.ryuqq.repoup.adapter.runner.metadata.PackageIndexCodec} - 정규화된 JSON</li>
 * </ul>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
package com.ryuqq.repoup.adapter.runner.metadata;
