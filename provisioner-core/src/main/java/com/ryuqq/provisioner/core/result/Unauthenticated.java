package com.ryuqq.provisioner.core.result;

import java.util.function.Function;

/**
 * 인증 실패 (토큰 만료, 권한 없음 등).
 *
 * @param detail 상세 설명
 * @param <T> 기대했던 값 타입
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record Unauthenticated<T>(String detail) implements CallResult<T> {

    public Unauthenticated {
        if (detail == null || detail.isBlank()) {
            detail = "unauthenticated";
        }
    }

    @Override
    public <R> CallResult<R> map(Function<? super T, ? extends R> mapper) {
        return new Unauthenticated<>(detail);
    }

    @Override
    public String describe() {
        return "unauthenticated: " + detail;
    }
}
