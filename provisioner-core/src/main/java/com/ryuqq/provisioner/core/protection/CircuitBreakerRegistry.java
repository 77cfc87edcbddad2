package com.ryuqq.provisioner.core.protection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 의존성 이름별 Circuit Breaker 레지스트리.
 *
 * <p>프로세스 전역 싱글톤 대신 명시적으로 생성하여 주입하는 객체입니다.
 * 테스트는 독립된 레지스트리를 만들어 서로 간섭 없이 실행할 수 있습니다.</p>
 *
 * <p><strong>생명주기:</strong></p>
 * <ul>
 *   <li>브레이커는 이름별로 최초 사용 시 한 번 생성되어 레지스트리와 수명을 같이함</li>
 *   <li>같은 이름으로 다시 요청하면 기존 인스턴스를 반환 (설정 무시)</li>
 *   <li>{@link #close()} 는 레지스트리가 만든 호출 실행기만 종료</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class CircuitBreakerRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    private final ConcurrentMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final Clock clock;
    private final CircuitBreakerListener listener;
    private final ExecutorService callExecutor;
    private final boolean ownsExecutor;

    /**
     * 시스템 시계와 NOOP 수신자로 생성.
     */
    public CircuitBreakerRegistry() {
        this(Clock.systemUTC(), CircuitBreakerListener.NOOP);
    }

    /**
     * 자체 호출 실행기를 갖는 레지스트리 생성.
     *
     * @param clock 시간 기준
     * @param listener 모든 브레이커가 공유하는 이벤트 수신자
     */
    public CircuitBreakerRegistry(Clock clock, CircuitBreakerListener listener) {
        this(clock, listener, Executors.newCachedThreadPool(new CallThreadFactory()), true);
    }

    /**
     * 외부 호출 실행기를 사용하는 레지스트리 생성.
     *
     * <p>실행기 종료는 호출자 책임입니다.</p>
     */
    public CircuitBreakerRegistry(Clock clock, CircuitBreakerListener listener, ExecutorService callExecutor) {
        this(clock, listener, callExecutor, false);
    }

    private CircuitBreakerRegistry(
        Clock clock,
        CircuitBreakerListener listener,
        ExecutorService callExecutor,
        boolean ownsExecutor
    ) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        if (callExecutor == null) {
            throw new IllegalArgumentException("callExecutor cannot be null");
        }
        this.clock = clock;
        this.listener = listener;
        this.callExecutor = callExecutor;
        this.ownsExecutor = ownsExecutor;
    }

    /**
     * 이름에 해당하는 브레이커 조회, 없으면 생성.
     *
     * @param config 생성 시 사용할 설정
     * @return 해당 의존성의 브레이커
     */
    public CircuitBreaker getOrCreate(CircuitBreakerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        CircuitBreaker existing = breakers.get(config.name());
        if (existing != null) {
            return existing;
        }

        DefaultCircuitBreaker created = new DefaultCircuitBreaker(config, clock, callExecutor, listener);
        CircuitBreaker previous = breakers.putIfAbsent(config.name(), created);
        if (previous != null) {
            return previous;
        }

        log.info("Circuit breaker '{}' created (failureThreshold={}, resetTimeout={}ms, callTimeout={}ms)",
            config.name(), config.failureThreshold(),
            config.resetTimeout().toMillis(), config.callTimeout().toMillis());
        try {
            listener.onCreated(created);
        } catch (RuntimeException e) {
            log.warn("Circuit breaker listener failed on creation of '{}'", config.name(), e);
        }
        return created;
    }

    public Optional<CircuitBreaker> get(String name) {
        return Optional.ofNullable(breakers.get(name));
    }

    /**
     * 등록된 모든 브레이커 (이름순).
     */
    public List<CircuitBreaker> all() {
        List<CircuitBreaker> list = new ArrayList<>(breakers.values());
        list.sort(Comparator.comparing(CircuitBreaker::getName));
        return list;
    }

    /**
     * 전체 건강 상태.
     *
     * @return 모든 브레이커가 CLOSED 이면 overallHealthy=true
     */
    public RegistryHealth healthStatus() {
        Map<String, CircuitBreakerMetrics> snapshots = new LinkedHashMap<>();
        boolean healthy = true;
        for (CircuitBreaker breaker : all()) {
            CircuitBreakerMetrics metrics = breaker.getMetrics();
            snapshots.put(breaker.getName(), metrics);
            healthy &= metrics.healthy();
        }
        return new RegistryHealth(healthy, snapshots);
    }

    /**
     * 모든 브레이커를 CLOSED 로 리셋.
     */
    public void resetAll() {
        log.warn("Resetting all {} circuit breakers", breakers.size());
        breakers.values().forEach(CircuitBreaker::reset);
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            callExecutor.shutdownNow();
        }
    }

    private static final class CallThreadFactory implements ThreadFactory {

        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "circuit-breaker-call-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
