package com.ryuqq.provisioner.adapter.runner;

import com.ryuqq.provisioner.application.provisioning.ProvisioningService;
import com.ryuqq.provisioner.core.model.ProvisioningRequest;
import com.ryuqq.provisioner.core.spi.RequestStore;
import com.ryuqq.provisioner.core.statemachine.ProvisioningStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * PROVISIONING 요청의 주기적 상태 동기화.
 *
 * <p>워크플로우 엔진은 완료를 통지하지 않으므로, 조회되지 않는 요청도 결국 종료 상태에 도달하도록
 * 주기적으로 엔진 상태를 확인합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. listByStatus(PROVISIONING, batchSize)
 * 2. 요청마다 service.refresh(requestId)
 *    - Succeeded → COMPLETED
 *    - Failed/Error → FAILED
 *    - 그 외 → 진행 메시지만 갱신
 * 3. 종료 상태로 바뀐 건수 로깅
 * </pre>
 *
 * <p>한 요청의 오류는 로그만 남기고 다음 요청을 계속 처리합니다.
 * 여러 인스턴스가 동시에 스캔해도 상태 전이는 저장소에서 직렬화되므로 안전합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class StatusPoller {

    private static final Logger log = LoggerFactory.getLogger(StatusPoller.class);

    private final RequestStore store;
    private final ProvisioningService service;
    private final StatusPollerConfig config;

    /**
     * 생성자.
     *
     * @param store 요청 저장소
     * @param service 프로비저닝 서비스
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public StatusPoller(RequestStore store, ProvisioningService service, StatusPollerConfig config) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (service == null) {
            throw new IllegalArgumentException("service cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.store = store;
        this.service = service;
        this.config = config;
    }

    /**
     * PROVISIONING 요청 스캔 및 동기화.
     *
     * <p>주기적으로 호출되어야 합니다 (예: @Scheduled).</p>
     *
     * @return 이번 스캔에서 종료 상태로 바뀐 요청 수
     */
    public int scan() {
        List<ProvisioningRequest> provisioning = store.listByStatus(ProvisioningStatus.PROVISIONING, config.batchSize());
        if (provisioning.isEmpty()) {
            log.debug("Status poll: no provisioning requests");
            return 0;
        }

        int finished = 0;
        for (ProvisioningRequest request : provisioning) {
            if (tryRefresh(request)) {
                finished++;
            }
        }

        log.info("Status poll completed: {} finished out of {} provisioning", finished, provisioning.size());
        return finished;
    }

    private boolean tryRefresh(ProvisioningRequest request) {
        try {
            ProvisioningRequest refreshed = service.refresh(request.getRequestId());
            if (refreshed.getStatus().isTerminal()) {
                log.info("Status poll moved {} to {}", request.getRequestId(), refreshed.getStatus());
                return true;
            }
            return false;
        } catch (RuntimeException e) {
            log.error("Failed to refresh {} in status poll", request.getRequestId(), e);
            return false;
        }
    }
}
