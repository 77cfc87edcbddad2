package com.ryuqq.provisioner.core.result;

import java.util.function.Function;

/**
 * 정상 응답.
 *
 * @param value 응답 값 (null 불가)
 * @param <T> 값 타입
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record Success<T>(T value) implements CallResult<T> {

    public Success {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }

    @Override
    public <R> CallResult<R> map(Function<? super T, ? extends R> mapper) {
        return new Success<>(mapper.apply(value));
    }

    @Override
    public String describe() {
        return "success";
    }
}
