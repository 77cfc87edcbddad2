package com.ryuqq.provisioner.core.result;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CallResultTest {

    @Test
    void ServiceError와_Unauthenticated만_브레이커_실패로_집계() {
        assertThat(CallResult.success("x").countsAsFailure()).isFalse();
        assertThat(CallResult.notFound("x").countsAsFailure()).isFalse();
        assertThat(CallResult.unauthenticated("expired").countsAsFailure()).isTrue();
        assertThat(CallResult.serviceError("HTTP 500").countsAsFailure()).isTrue();
    }

    @Test
    void map은_실패_종류와_상세를_유지() {
        CallResult<Integer> mapped = CallResult.<String>notFound("user 42").map(String::length);

        assertThat(mapped).isInstanceOf(NotFound.class);
        assertThat(mapped.describe()).isEqualTo("not found: user 42");
        assertThat(CallResult.success("abc").map(String::length)).isEqualTo(new Success<>(3));
    }
}
