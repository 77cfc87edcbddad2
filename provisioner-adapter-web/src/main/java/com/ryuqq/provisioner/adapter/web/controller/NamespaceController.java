package com.ryuqq.provisioner.adapter.web.controller;

import com.ryuqq.provisioner.adapter.runner.CompletionWatcher;
import com.ryuqq.provisioner.adapter.web.dto.CreateNamespaceBody;
import com.ryuqq.provisioner.adapter.web.dto.CreateNamespaceResponse;
import com.ryuqq.provisioner.adapter.web.dto.NamespaceResponse;
import com.ryuqq.provisioner.application.provisioning.ProvisioningService;
import com.ryuqq.provisioner.core.model.ProvisioningRequest;
import com.ryuqq.provisioner.core.model.RequestId;
import com.ryuqq.provisioner.core.statemachine.ProvisioningStatus;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 네임스페이스 프로비저닝 REST 엔드포인트.
 *
 * <p><strong>엔드포인트:</strong></p>
 * <ul>
 *   <li>{@code POST /namespaces}: 요청 접수 (202)</li>
 *   <li>{@code GET /namespaces/{requestId}/status}: 현재 상태</li>
 *   <li>{@code DELETE /namespaces/{requestId}}: 취소</li>
 *   <li>{@code GET /namespaces?team=x}: 팀별 목록</li>
 * </ul>
 *
 * <p>제출에 성공한 요청은 {@link CompletionWatcher} 가 완료까지 추적합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
@RestController
@RequestMapping("/namespaces")
public class NamespaceController {

    private static final Logger log = LoggerFactory.getLogger(NamespaceController.class);

    private final ProvisioningService provisioningService;
    private final CompletionWatcher completionWatcher;

    public NamespaceController(ProvisioningService provisioningService, CompletionWatcher completionWatcher) {
        this.provisioningService = provisioningService;
        this.completionWatcher = completionWatcher;
    }

    @PostMapping
    public ResponseEntity<CreateNamespaceResponse> create(@Valid @RequestBody CreateNamespaceBody body) {
        ProvisioningRequest created = provisioningService.createNamespace(body.toRequest());
        if (created.getStatus() == ProvisioningStatus.PROVISIONING) {
            completionWatcher.watch(created.getRequestId());
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(CreateNamespaceResponse.from(created));
    }

    @GetMapping("/{requestId}/status")
    public NamespaceResponse status(@PathVariable String requestId) {
        return NamespaceResponse.from(provisioningService.getStatus(RequestId.of(requestId)));
    }

    @DeleteMapping("/{requestId}")
    public NamespaceResponse cancel(@PathVariable String requestId) {
        RequestId id = RequestId.of(requestId);
        ProvisioningRequest cancelled = provisioningService.cancel(id);
        if (completionWatcher.stopWatching(id)) {
            log.debug("Stopped completion watch for {}", id);
        }
        return NamespaceResponse.from(cancelled);
    }

    @GetMapping
    public List<NamespaceResponse> listByTeam(@RequestParam String team) {
        return provisioningService.listByTeam(team).stream()
            .map(NamespaceResponse::from)
            .toList();
    }
}
