/**
 * Package Descriptor 추출 - 파일 이름 및 헤더 기반 패키지 식별.
 *
 * <h2>핵심 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.repoup.core.descriptor.PackageDescriptorExtractor} - 추출기 계약</li>
 *   <li>{@link com.ryuqq.repoup.core.descriptor.RpmDescriptorExtractor} - RPM (파일 이름 + 헤더)</li>
 *   <li>{@link com.ryuqq.repoup.core.descriptor.DebDescriptorExtractor} - DEB (파일 이름)</li>
 *   <li>{@link com.ryuqq.repoup.core.descriptor.DescriptorExtractors} - 파일 이름 기반 디스패치</li>
 * </ul>
 *
 * <h2>충돌 처리</h2>
 * <p>헤더 값이 항상 우선하며, 파일 이름과 다른 필드는
 * {@link com.ryuqq.repoup.core.descriptor.DescriptorMismatch}로 보고됩니다 (경고, 비치명적).</p>
 *
 * @since 1.0.0
 * @author Repoup Team
 */
package com.ryuqq.repoup.core.descriptor;
