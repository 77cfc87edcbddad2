package com.ryuqq.provisioner.core.model;

import java.time.Clock;
import java.util.UUID;

/**
 * 프로비저닝 요청의 전역 고유 식별자.
 *
 * <p>요청 접수 시점에 생성되며, 상태 조회와 취소, 워크플로우 라벨링에 사용됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~128자</li>
 *   <li>패턴: 영숫자, 하이픈(-)만 허용 (워크플로우 이름과 라벨 값에 그대로 쓰이기 때문)</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class RequestId {

    private static final int MAX_LENGTH = 128;

    private final String value;

    private RequestId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("RequestId cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("RequestId length cannot exceed " + MAX_LENGTH + " characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-]+$")) {
            throw new IllegalArgumentException("RequestId contains invalid characters. Only alphanumeric and hyphen are allowed");
        }
        this.value = value;
    }

    /**
     * RequestId 생성.
     *
     * @param value RequestId 값
     * @return RequestId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static RequestId of(String value) {
        return new RequestId(value);
    }

    /**
     * 새 RequestId 발급.
     *
     * <p>형식: {@code ns-<epochMillis>-<uuid 앞 8자리>}</p>
     *
     * @param clock 발급 시각 기준 시계
     * @return 새 RequestId
     */
    public static RequestId generate(Clock clock) {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        return new RequestId("ns-" + clock.millis() + "-" + suffix);
    }

    /**
     * RequestId 값 조회.
     *
     * @return RequestId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RequestId requestId = (RequestId) o;
        return value.equals(requestId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
