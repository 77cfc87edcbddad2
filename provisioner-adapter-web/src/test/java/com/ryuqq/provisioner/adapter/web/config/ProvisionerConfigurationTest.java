package com.ryuqq.provisioner.adapter.web.config;

import com.ryuqq.provisioner.application.workflow.PollingPolicy;
import com.ryuqq.provisioner.application.workflow.WorkflowOrchestrationClient;
import com.ryuqq.provisioner.core.model.WorkflowPhase;
import com.ryuqq.provisioner.core.model.WorkflowRef;
import com.ryuqq.provisioner.core.model.WorkflowStatus;
import com.ryuqq.provisioner.core.protection.CircuitBreaker;
import com.ryuqq.provisioner.core.protection.CircuitBreakerConfig;
import com.ryuqq.provisioner.core.protection.CircuitBreakerListener;
import com.ryuqq.provisioner.core.protection.CircuitBreakerRegistry;
import com.ryuqq.provisioner.core.protection.DefaultCircuitBreaker;
import com.ryuqq.provisioner.core.protection.noop.NoOpCircuitBreaker;
import com.ryuqq.provisioner.testkit.fake.FakeWorkflowEngine;
import com.ryuqq.provisioner.testkit.time.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ProvisionerConfiguration / ProvisionerProperties 조립 테스트 (Spring 컨텍스트 없이).
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
class ProvisionerConfigurationTest {

    private static final ProvisionerProperties.Breaker DEFAULTS = new ProvisionerProperties.Breaker(null, null, null);

    private CircuitBreakerRegistry registry;
    private FakeWorkflowEngine engine;

    @BeforeEach
    void setUp() {
        registry = new CircuitBreakerRegistry(MutableClock.startingAtEpochOfTests(), CircuitBreakerListener.NOOP);
        engine = new FakeWorkflowEngine();
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    @Nested
    class BreakerWiring {

        @Test
        void 기본값은_레지스트리에_등록된_브레이커() {
            // given
            ProvisionerProperties.Breakers breakers = new ProvisionerProperties.Breakers(true, DEFAULTS, DEFAULTS);

            // when
            CircuitBreaker identity = breakers.identityDirectoryBreaker(registry);
            CircuitBreaker workflow = breakers.workflowEngineBreaker(registry);

            // then
            assertThat(identity).isInstanceOf(DefaultCircuitBreaker.class);
            assertThat(workflow).isInstanceOf(DefaultCircuitBreaker.class);
            assertThat(registry.get(CircuitBreakerConfig.IDENTITY_DIRECTORY)).containsSame(identity);
            assertThat(registry.get(CircuitBreakerConfig.WORKFLOW_ENGINE)).containsSame(workflow);
        }

        @Test
        void 비활성화하면_NoOp_브레이커로_호출하고_레지스트리에_등록하지_않음() {
            // given
            ProvisionerProperties.Breakers breakers = new ProvisionerProperties.Breakers(false, DEFAULTS, DEFAULTS);

            // when
            CircuitBreaker workflow = breakers.workflowEngineBreaker(registry);
            CircuitBreaker identity = breakers.identityDirectoryBreaker(registry);

            // then
            assertThat(workflow).isInstanceOf(NoOpCircuitBreaker.class);
            assertThat(workflow.getName()).isEqualTo(CircuitBreakerConfig.WORKFLOW_ENGINE);
            assertThat(identity.getName()).isEqualTo(CircuitBreakerConfig.IDENTITY_DIRECTORY);
            assertThat(registry.all()).isEmpty();

            workflow.forceOpen();
            assertThat(workflow.execute(() -> "ok")).isEqualTo("ok");
        }

        @Test
        void 일부_항목만_덮어쓰면_나머지는_기본값을_유지하고_병합_결과로_검증() {
            // given: 기본 callTimeout 30s 보다 짧은 resetTimeout 을 callTimeout 과 함께 덮어씀
            ProvisionerProperties.Breakers breakers = new ProvisionerProperties.Breakers(
                true,
                DEFAULTS,
                new ProvisionerProperties.Breaker(null, Duration.ofSeconds(10), Duration.ofSeconds(2))
            );

            // when
            CircuitBreakerConfig config = breakers.workflowEngineConfig();

            // then
            assertThat(config.failureThreshold()).isEqualTo(3);
            assertThat(config.resetTimeout()).isEqualTo(Duration.ofSeconds(10));
            assertThat(config.callTimeout()).isEqualTo(Duration.ofSeconds(2));
        }

        @Test
        void 병합_결과의_callTimeout이_resetTimeout_이상이면_예외() {
            // given
            ProvisionerProperties.Breakers breakers = new ProvisionerProperties.Breakers(
                true,
                DEFAULTS,
                new ProvisionerProperties.Breaker(null, Duration.ofSeconds(10), null)
            );

            // when / then
            assertThatThrownBy(breakers::workflowEngineConfig)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("callTimeout must be shorter than resetTimeout");
        }
    }

    @Test
    void 워크플로우_클라이언트는_주입된_Clock으로_대기_기한을_계산() {
        // given: instant() 를 읽을 때마다 1시간씩 흐르는 시계
        Clock stepping = new SteppingClock(Instant.parse("2024-01-01T00:00:00Z"), Duration.ofHours(1));
        WorkflowRef ref = WorkflowRef.of("provision-namespace-ns-1");
        engine.setStatus(ref, WorkflowPhase.RUNNING, null);
        WorkflowOrchestrationClient client = new ProvisionerConfiguration()
            .workflowOrchestrationClient(engine, registry, properties(true), stepping);

        // when
        WorkflowStatus status = client.waitForCompletion(
            ref, PollingPolicy.fixed(Duration.ofSeconds(1), Duration.ofMinutes(10))
        );

        // then
        assertThat(status.waitTimedOut()).isTrue();
        assertThat(engine.fetchCalls()).isEqualTo(1);
    }

    private static ProvisionerProperties properties(boolean breakersEnabled) {
        return new ProvisionerProperties(
            new ProvisionerProperties.WorkflowEngine("http://localhost:2746", "token", "platform", Duration.ofSeconds(10)),
            new ProvisionerProperties.Directory("http://localhost:8089/v1.0", "token", Duration.ofSeconds(5)),
            new ProvisionerProperties.Breakers(breakersEnabled, DEFAULTS, DEFAULTS),
            new ProvisionerProperties.Provisioning(10, List.of(), "platform-provisioner", Map.of()),
            new ProvisionerProperties.Poller(false, 30000, 100, Duration.ofSeconds(5), Duration.ofMinutes(10), 4)
        );
    }

    private static final class SteppingClock extends Clock {

        private final Instant start;
        private final Duration step;
        private final AtomicLong reads = new AtomicLong();

        SteppingClock(Instant start, Duration step) {
            this.start = start;
            this.step = step;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return start.plus(step.multipliedBy(reads.getAndIncrement()));
        }
    }
}
