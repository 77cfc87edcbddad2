package com.ryuqq.provisioner.core.result;

import java.util.function.Function;

/**
 * 전송 실패, 서버 오류, 브레이커 거부 등 의존성 이용 불가.
 *
 * @param detail 상세 설명
 * @param cause 원인 (nullable)
 * @param <T> 기대했던 값 타입
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record ServiceError<T>(String detail, Throwable cause) implements CallResult<T> {

    public ServiceError {
        if (detail == null || detail.isBlank()) {
            detail = cause != null && cause.getMessage() != null ? cause.getMessage() : "service error";
        }
    }

    @Override
    public <R> CallResult<R> map(Function<? super T, ? extends R> mapper) {
        return new ServiceError<>(detail, cause);
    }

    @Override
    public String describe() {
        return "service error: " + detail;
    }
}
