/**
 * 프로비저닝 도메인 모델.
 *
 * <p>요청 식별자, 요청 레코드, 리소스 등급 테이블, 디렉터리 주체,
 * 워크플로우 상태 스냅샷 등 모든 계층이 공유하는 불변 값 타입을 정의합니다.</p>
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.core.model;
