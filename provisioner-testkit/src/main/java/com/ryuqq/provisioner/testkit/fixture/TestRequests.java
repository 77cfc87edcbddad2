package com.ryuqq.provisioner.testkit.fixture;

import com.ryuqq.provisioner.core.model.Environment;
import com.ryuqq.provisioner.core.model.NamespaceRequest;
import com.ryuqq.provisioner.core.model.ProvisioningRequest;
import com.ryuqq.provisioner.core.model.RequestId;
import com.ryuqq.provisioner.core.model.ResourceTier;

import java.time.Instant;

/**
 * Request fixtures shared by tests.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class TestRequests {

    public static final String REQUESTED_BY = "alice@example.com";

    private TestRequests() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * development / small request for the given name and team.
     */
    public static NamespaceRequest namespaceRequest(String namespaceName, String team) {
        return NamespaceRequest.of(namespaceName, team, Environment.DEVELOPMENT, "small", REQUESTED_BY);
    }

    /**
     * PENDING record built from {@link #namespaceRequest(String, String)}.
     */
    public static ProvisioningRequest pending(String requestId, String namespaceName, String team, Instant createdAt) {
        return ProvisioningRequest.pending(
            RequestId.of(requestId),
            namespaceRequest(namespaceName, team),
            ResourceTier.SMALL,
            createdAt
        );
    }
}
