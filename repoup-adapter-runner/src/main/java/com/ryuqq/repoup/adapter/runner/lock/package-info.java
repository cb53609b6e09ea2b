/**
 * Lease Lock - 조건부 쓰기 기반 저장소 단위 상호 배제.
 *
 * <h2>핵심 클래스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.repoup.adapter.runner.lock.LeaseLockManager} - 획득 / 갱신 / 해제</li>
 *   <li>{@link com.ryuqq.repoup.adapter.runner.lock.LeaseHandle} - 보유 토큰과 lease 상태</li>
 *   <li>{@link com.ryuqq.repoup.adapter.runner.lock.LockConfig} - lease 시간, 재시도 한도, backoff</li>
 * </ul>
 *
 * <h2>불변식</h2>
 * <p>저장소마다 유효한(만료되지 않은) lease는 최대 하나입니다. 만료된 lease의 회수는
 * 방금 읽은 버전 토큰을 전제 조건으로 하므로 동시 회수자 중 하나만 성공합니다.</p>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
package com.ryuqq.repoup.adapter.runner.lock;
