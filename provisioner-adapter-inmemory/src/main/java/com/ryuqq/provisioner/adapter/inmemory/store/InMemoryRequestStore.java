package com.ryuqq.provisioner.adapter.inmemory.store;

import com.ryuqq.provisioner.core.error.RequestNotFoundException;
import com.ryuqq.provisioner.core.model.ProvisioningRequest;
import com.ryuqq.provisioner.core.model.RequestId;
import com.ryuqq.provisioner.core.spi.RequestStore;
import com.ryuqq.provisioner.core.statemachine.ProvisioningStatus;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link RequestStore} SPI.
 *
 * <p>Records live in a {@link ConcurrentHashMap} keyed by {@link RequestId}. Updates go through
 * {@link ConcurrentHashMap#compute}, which runs the updater while holding the entry's bin lock,
 * so updates of one request are serialized while different requests proceed in parallel.</p>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>save / findById / update:</strong> O(1)</li>
 *   <li><strong>listByTeam / listByStatus / findByNamespaceName:</strong> O(N log N) full scan and sort</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Updaters must not call back into the store for the same request</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class InMemoryRequestStore implements RequestStore {

    private static final Comparator<ProvisioningRequest> OLDEST_FIRST = Comparator
        .comparing(ProvisioningRequest::getCreatedAt)
        .thenComparing(request -> request.getRequestId().getValue());

    private final ConcurrentHashMap<RequestId, ProvisioningRequest> requests = new ConcurrentHashMap<>();

    @Override
    public void save(ProvisioningRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        ProvisioningRequest previous = requests.putIfAbsent(request.getRequestId(), request);
        if (previous != null) {
            throw new IllegalStateException("Request already exists: " + request.getRequestId());
        }
    }

    @Override
    public Optional<ProvisioningRequest> findById(RequestId requestId) {
        if (requestId == null) {
            throw new IllegalArgumentException("requestId cannot be null");
        }
        return Optional.ofNullable(requests.get(requestId));
    }

    @Override
    public ProvisioningRequest update(RequestId requestId, UnaryOperator<ProvisioningRequest> updater) {
        if (requestId == null) {
            throw new IllegalArgumentException("requestId cannot be null");
        }
        if (updater == null) {
            throw new IllegalArgumentException("updater cannot be null");
        }
        ProvisioningRequest committed = requests.computeIfPresent(requestId, (id, current) -> {
            ProvisioningRequest next = updater.apply(current);
            if (next == null) {
                throw new IllegalStateException("updater returned null for request " + id);
            }
            if (!next.getRequestId().equals(id)) {
                throw new IllegalStateException("updater changed request id " + id + " to " + next.getRequestId());
            }
            return next;
        });
        if (committed == null) {
            throw new RequestNotFoundException(requestId);
        }
        return committed;
    }

    @Override
    public List<ProvisioningRequest> listByTeam(String team) {
        return requests.values().stream()
            .filter(request -> request.getTeam().equals(team))
            .sorted(OLDEST_FIRST)
            .collect(Collectors.toList());
    }

    @Override
    public List<ProvisioningRequest> listByStatus(ProvisioningStatus status, int limit) {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive (current: " + limit + ")");
        }
        return requests.values().stream()
            .filter(request -> request.getStatus() == status)
            .sorted(OLDEST_FIRST)
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public List<ProvisioningRequest> findByNamespaceName(String namespaceName) {
        return requests.values().stream()
            .filter(request -> request.getNamespaceName().equals(namespaceName))
            .sorted(OLDEST_FIRST)
            .collect(Collectors.toList());
    }

    /**
     * Removes all records (tests only).
     */
    public void clear() {
        requests.clear();
    }

    public int size() {
        return requests.size();
    }
}
