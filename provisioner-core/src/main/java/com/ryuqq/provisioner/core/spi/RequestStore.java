package com.ryuqq.provisioner.core.spi;

import com.ryuqq.provisioner.core.model.ProvisioningRequest;
import com.ryuqq.provisioner.core.model.RequestId;
import com.ryuqq.provisioner.core.statemachine.ProvisioningStatus;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Storage SPI for provisioning request records.
 *
 * <p>The provisioning service is the single writer of these records. The store is
 * responsible for serializing writes per {@link RequestId} so that status transitions
 * are never lost or observed out of order.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods may be called concurrently</li>
 *   <li>Per-request atomicity: {@link #update} applies its function atomically with respect to
 *       other updates of the same request</li>
 *   <li>Read monotonicity: once an update is committed, reads never return an earlier version</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public interface RequestStore {

    /**
     * Stores a new request record.
     *
     * @param request the record to store
     * @throws IllegalArgumentException if request is null
     * @throws IllegalStateException if a record with the same request ID already exists
     */
    void save(ProvisioningRequest request);

    /**
     * Finds a request by its ID.
     *
     * @param requestId the request ID
     * @return the current record, or empty if unknown
     */
    Optional<ProvisioningRequest> findById(RequestId requestId);

    /**
     * Atomically replaces a record with the result of {@code updater}.
     *
     * <p>The updater receives the current committed version. If it throws, nothing is written
     * and the exception propagates. If it returns the same instance, nothing is written.</p>
     *
     * @param requestId the request ID
     * @param updater function computing the next version
     * @return the committed version after the update
     * @throws com.ryuqq.provisioner.core.error.RequestNotFoundException if the request does not exist
     */
    ProvisioningRequest update(RequestId requestId, UnaryOperator<ProvisioningRequest> updater);

    /**
     * Lists all requests of a team, oldest first.
     *
     * @param team team name
     * @return requests of the team (never null)
     */
    List<ProvisioningRequest> listByTeam(String team);

    /**
     * Lists requests currently in the given status, oldest first.
     *
     * @param status status filter
     * @param limit maximum number of records (must be positive)
     * @return matching requests (never null)
     */
    List<ProvisioningRequest> listByStatus(ProvisioningStatus status, int limit);

    /**
     * Lists every request recorded for a namespace name, in any status.
     *
     * @param namespaceName namespace name
     * @return matching requests (never null)
     */
    List<ProvisioningRequest> findByNamespaceName(String namespaceName);
}
