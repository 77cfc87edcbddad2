package com.ryuqq.provisioner.adapter.web.metrics;

import com.ryuqq.provisioner.core.protection.CircuitBreaker;
import com.ryuqq.provisioner.core.protection.CircuitBreakerConfig;
import com.ryuqq.provisioner.core.protection.CircuitBreakerRegistry;
import com.ryuqq.provisioner.testkit.time.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * MicrometerCircuitBreakerListener 테스트.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
class MicrometerCircuitBreakerListenerTest {

    private SimpleMeterRegistry meterRegistry;
    private CircuitBreakerRegistry registry;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        registry = new CircuitBreakerRegistry(
            MutableClock.startingAtEpochOfTests(),
            new MicrometerCircuitBreakerListener(meterRegistry)
        );
        breaker = registry.getOrCreate(CircuitBreakerConfig.of("workflow-engine").withFailureThreshold(2));
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    @Test
    void 생성_시_상태_게이지_등록() {
        assertThat(stateGauge()).isEqualTo(0.0);

        breaker.forceOpen();

        assertThat(stateGauge()).isEqualTo(2.0);
    }

    @Test
    void 호출_결과와_상태_전이를_집계() {
        // given
        breaker.execute(() -> "ok");

        // when
        for (int i = 0; i < 2; i++) {
            assertThatThrownBy(() -> breaker.execute(() -> {
                throw new IOException("connection refused");
            })).isInstanceOf(RuntimeException.class);
        }
        assertThatThrownBy(() -> breaker.execute(() -> "rejected")).isInstanceOf(RuntimeException.class);

        // then
        assertThat(calls("success")).isEqualTo(1.0);
        assertThat(calls("failure")).isEqualTo(2.0);
        assertThat(calls("rejected")).isEqualTo(1.0);
        assertThat(meterRegistry.get(MicrometerCircuitBreakerListener.TRANSITIONS)
            .tag("name", "workflow-engine")
            .tag("from", "CLOSED")
            .tag("to", "OPEN")
            .counter()
            .count()).isEqualTo(1.0);
    }

    private double stateGauge() {
        return meterRegistry.get(MicrometerCircuitBreakerListener.STATE).tag("name", "workflow-engine").gauge().value();
    }

    private double calls(String result) {
        return meterRegistry.get(MicrometerCircuitBreakerListener.CALLS)
            .tag("name", "workflow-engine")
            .tag("result", result)
            .counter()
            .count();
    }
}
