package com.ryuqq.provisioner.adapter.web.metrics;

import com.ryuqq.provisioner.core.protection.CallOutcome;
import com.ryuqq.provisioner.core.protection.CircuitBreaker;
import com.ryuqq.provisioner.core.protection.CircuitBreakerListener;
import com.ryuqq.provisioner.core.protection.CircuitBreakerState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * 서킷 브레이커 이벤트를 Micrometer 로 내보내는 수신자.
 *
 * <p><strong>메트릭:</strong></p>
 * <ul>
 *   <li>{@code provisioner.circuitbreaker.state{name}}: 0=CLOSED, 1=HALF_OPEN, 2=OPEN</li>
 *   <li>{@code provisioner.circuitbreaker.transitions{name,from,to}}: 상태 전이 수</li>
 *   <li>{@code provisioner.circuitbreaker.calls{name,result}}: success / failure / timeout / rejected</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class MicrometerCircuitBreakerListener implements CircuitBreakerListener {

    static final String STATE = "provisioner.circuitbreaker.state";
    static final String TRANSITIONS = "provisioner.circuitbreaker.transitions";
    static final String CALLS = "provisioner.circuitbreaker.calls";

    private final MeterRegistry meterRegistry;

    public MicrometerCircuitBreakerListener(MeterRegistry meterRegistry) {
        if (meterRegistry == null) {
            throw new IllegalArgumentException("meterRegistry cannot be null");
        }
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void onCreated(CircuitBreaker breaker) {
        Gauge.builder(STATE, breaker, b -> b.getState().gaugeValue())
            .description("Circuit breaker state (0=closed, 1=half-open, 2=open)")
            .tag("name", breaker.getName())
            .register(meterRegistry);
    }

    @Override
    public void onStateTransition(String name, CircuitBreakerState from, CircuitBreakerState to) {
        Counter.builder(TRANSITIONS)
            .tag("name", name)
            .tag("from", from.name())
            .tag("to", to.name())
            .register(meterRegistry)
            .increment();
    }

    @Override
    public void onCall(String name, CallOutcome outcome) {
        Counter.builder(CALLS)
            .tag("name", name)
            .tag("result", outcome.tag())
            .register(meterRegistry)
            .increment();
    }
}
