/**
 * Circuit Breaker 보호 패키지.
 *
 * <p>외부 의존성(워크플로우 엔진, 디렉터리)의 장애를 격리하기 위한 연속 실패 기반
 * Circuit Breaker 와 이를 이름별로 관리하는 레지스트리를 제공합니다.</p>
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.core.protection.CircuitBreaker} - 브레이커 SPI</li>
 *   <li>{@link com.ryuqq.provisioner.core.protection.DefaultCircuitBreaker} - 기본 구현</li>
 *   <li>{@link com.ryuqq.provisioner.core.protection.CircuitBreakerRegistry} - 의존성 이름별 레지스트리</li>
 *   <li>{@link com.ryuqq.provisioner.core.protection.CircuitBreakerListener} - 메트릭 연동 확장점</li>
 *   <li>{@link com.ryuqq.provisioner.core.protection.noop.NoOpCircuitBreaker} - 보호 없는 구현</li>
 * </ul>
 *
 * <h2>실패 집계 규칙</h2>
 * <ul>
 *   <li>예외, 호출 타임아웃: 실패</li>
 *   <li>결과 판정 함수가 true 를 반환한 결과: 실패 (예: ServiceError, Unauthenticated)</li>
 *   <li>NotFound 와 같은 정상 부정 결과: 성공</li>
 *   <li>거부된 호출: 집계 대상 아님 (rejectedCount 만 증가)</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
package com.ryuqq.provisioner.core.protection;
