package com.ryuqq.provisioner.adapter.web.config;

import com.ryuqq.provisioner.adapter.http.auth.StaticAccessTokenProvider;
import com.ryuqq.provisioner.adapter.http.directory.HttpIdentityDirectory;
import com.ryuqq.provisioner.adapter.http.workflow.HttpWorkflowEngine;
import com.ryuqq.provisioner.adapter.inmemory.store.InMemoryRequestStore;
import com.ryuqq.provisioner.adapter.runner.CompletionWatcher;
import com.ryuqq.provisioner.adapter.runner.StatusPoller;
import com.ryuqq.provisioner.adapter.web.metrics.MicrometerCircuitBreakerListener;
import com.ryuqq.provisioner.application.identity.DirectoryPrincipalValidator;
import com.ryuqq.provisioner.application.identity.PrincipalValidator;
import com.ryuqq.provisioner.application.provisioning.DefaultProvisioningService;
import com.ryuqq.provisioner.application.provisioning.ProvisioningService;
import com.ryuqq.provisioner.application.workflow.Sleeper;
import com.ryuqq.provisioner.application.workflow.WorkflowOrchestrationClient;
import com.ryuqq.provisioner.core.protection.CircuitBreakerRegistry;
import com.ryuqq.provisioner.core.spi.IdentityDirectory;
import com.ryuqq.provisioner.core.spi.RequestStore;
import com.ryuqq.provisioner.core.spi.WorkflowEngine;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 라이브러리 모듈 조립.
 *
 * <p>외부 의존성 어댑터(워크플로우 엔진, 디렉터리)와 저장소는 {@link ConditionalOnMissingBean} 으로
 * 선언되어 테스트나 다른 배포 구성에서 교체할 수 있습니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
@Configuration(proxyBeanMethods = false)
@EnableScheduling
public class ProvisionerConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MicrometerCircuitBreakerListener circuitBreakerListener(MeterRegistry meterRegistry) {
        return new MicrometerCircuitBreakerListener(meterRegistry);
    }

    @Bean(destroyMethod = "close")
    public CircuitBreakerRegistry circuitBreakerRegistry(Clock clock, MicrometerCircuitBreakerListener listener) {
        return new CircuitBreakerRegistry(clock, listener);
    }

    @Bean
    @ConditionalOnMissingBean
    public RequestStore requestStore() {
        return new InMemoryRequestStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowEngine workflowEngine(ProvisionerProperties properties) {
        ProvisionerProperties.WorkflowEngine engine = properties.workflowEngine();
        return new HttpWorkflowEngine(
            engine.toEndpoint(),
            engine.namespace(),
            new StaticAccessTokenProvider(engine.token())
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public IdentityDirectory identityDirectory(ProvisionerProperties properties) {
        ProvisionerProperties.Directory directory = properties.directory();
        return new HttpIdentityDirectory(directory.toEndpoint(), new StaticAccessTokenProvider(directory.token()));
    }

    @Bean
    public WorkflowOrchestrationClient workflowOrchestrationClient(
        WorkflowEngine workflowEngine,
        CircuitBreakerRegistry registry,
        ProvisionerProperties properties,
        Clock clock
    ) {
        return new WorkflowOrchestrationClient(
            workflowEngine,
            properties.breakers().workflowEngineBreaker(registry),
            clock,
            Sleeper.SYSTEM
        );
    }

    @Bean
    public PrincipalValidator principalValidator(
        IdentityDirectory identityDirectory,
        CircuitBreakerRegistry registry,
        ProvisionerProperties properties
    ) {
        return new DirectoryPrincipalValidator(
            identityDirectory,
            properties.breakers().identityDirectoryBreaker(registry)
        );
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService workflowCleanupExecutor() {
        return Executors.newSingleThreadExecutor(namedThreads("workflow-cleanup"));
    }

    @Bean
    public ProvisioningService provisioningService(
        RequestStore requestStore,
        WorkflowOrchestrationClient workflowClient,
        PrincipalValidator principalValidator,
        ProvisionerProperties properties,
        Clock clock,
        ExecutorService workflowCleanupExecutor
    ) {
        return new DefaultProvisioningService(
            requestStore,
            workflowClient,
            principalValidator,
            properties.provisioning().toConfig(),
            clock,
            workflowCleanupExecutor
        );
    }

    @Bean
    public StatusPoller statusPoller(
        RequestStore requestStore,
        ProvisioningService provisioningService,
        ProvisionerProperties properties
    ) {
        return new StatusPoller(requestStore, provisioningService, properties.poller().toConfig());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService completionWatcherExecutor(ProvisionerProperties properties) {
        return Executors.newFixedThreadPool(properties.poller().watcherThreads(), namedThreads("completion-watcher"));
    }

    @Bean
    public CompletionWatcher completionWatcher(
        RequestStore requestStore,
        ProvisioningService provisioningService,
        WorkflowOrchestrationClient workflowClient,
        ExecutorService completionWatcherExecutor,
        ProvisionerProperties properties
    ) {
        return new CompletionWatcher(
            requestStore,
            provisioningService,
            workflowClient,
            completionWatcherExecutor,
            properties.poller().toPollingPolicy()
        );
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
