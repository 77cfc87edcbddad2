package com.ryuqq.provisioner.adapter.web.scheduler;

import com.ryuqq.provisioner.adapter.runner.StatusPoller;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * PROVISIONING 요청 주기 점검.
 *
 * <p>{@code provisioner.poller.enabled=false} 이면 등록되지 않습니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
@Component
@ConditionalOnProperty(prefix = "provisioner.poller", name = "enabled", havingValue = "true", matchIfMissing = true)
public class StatusPollerScheduler {

    private final StatusPoller statusPoller;

    public StatusPollerScheduler(StatusPoller statusPoller) {
        this.statusPoller = statusPoller;
    }

    @Scheduled(
        initialDelayString = "${provisioner.poller.scan-interval-ms:30000}",
        fixedDelayString = "${provisioner.poller.scan-interval-ms:30000}"
    )
    public void scan() {
        statusPoller.scan();
    }
}
