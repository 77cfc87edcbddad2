package com.ryuqq.provisioner.adapter.inmemory.store;

import com.ryuqq.provisioner.core.spi.RequestStore;
import com.ryuqq.provisioner.testkit.contract.AbstractRequestStoreContractTest;
import com.ryuqq.provisioner.testkit.fixture.TestRequests;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract tests for {@link InMemoryRequestStore}.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
class InMemoryRequestStoreContractTest extends AbstractRequestStoreContractTest {

    @Override
    protected RequestStore createStore() {
        return new InMemoryRequestStore();
    }

    @Test
    void clear는_모든_레코드를_삭제() {
        InMemoryRequestStore inMemory = (InMemoryRequestStore) store;
        inMemory.save(TestRequests.pending("ns-1", "demo-dev", "demo", T0));

        inMemory.clear();

        assertThat(inMemory.size()).isZero();
    }
}
