package com.ryuqq.provisioner.core.result;

import java.util.function.Function;

/**
 * 대상이 존재하지 않음. 서킷 브레이커 실패로 집계하지 않습니다.
 *
 * @param detail 상세 설명
 * @param <T> 기대했던 값 타입
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record NotFound<T>(String detail) implements CallResult<T> {

    public NotFound {
        if (detail == null || detail.isBlank()) {
            detail = "not found";
        }
    }

    @Override
    public <R> CallResult<R> map(Function<? super T, ? extends R> mapper) {
        return new NotFound<>(detail);
    }

    @Override
    public String describe() {
        return "not found: " + detail;
    }
}
