package com.ryuqq.provisioner.core.statemachine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static com.ryuqq.provisioner.core.statemachine.ProvisioningStatus.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * StatusTransition 테스트.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
class StatusTransitionTest {

    // ========== 정상 전이 ==========

    @Test
    void transition_정상_흐름_COMPLETED() {
        // Given
        ProvisioningStatus status = PENDING;

        // When
        status = StatusTransition.transition(status, PROVISIONING);
        status = StatusTransition.transition(status, COMPLETED);

        // Then
        assertEquals(COMPLETED, status);
        assertTrue(status.isTerminal());
    }

    @Test
    void validate_PENDING에서_FAILED와_CANCELLED_허용() {
        assertDoesNotThrow(() -> StatusTransition.validate(PENDING, FAILED));
        assertDoesNotThrow(() -> StatusTransition.validate(PENDING, CANCELLED));
    }

    @Test
    void validate_PROVISIONING에서_FAILED와_CANCELLED_허용() {
        assertDoesNotThrow(() -> StatusTransition.validate(PROVISIONING, FAILED));
        assertDoesNotThrow(() -> StatusTransition.validate(PROVISIONING, CANCELLED));
    }

    // ========== 불법 전이 ==========

    @ParameterizedTest
    @EnumSource(value = ProvisioningStatus.class, names = {"COMPLETED", "FAILED", "CANCELLED"})
    void validate_종료_상태에서는_어떤_전이도_불가(ProvisioningStatus terminal) {
        for (ProvisioningStatus target : ProvisioningStatus.values()) {
            IllegalStateException exception = assertThrows(
                IllegalStateException.class,
                () -> StatusTransition.validate(terminal, target)
            );
            assertTrue(exception.getMessage().contains("terminal"));
        }
    }

    @Test
    void validate_역방향_전이_불가() {
        assertThrows(IllegalStateException.class, () -> StatusTransition.validate(PROVISIONING, PENDING));
        assertThrows(IllegalStateException.class, () -> StatusTransition.validate(PENDING, COMPLETED));
        assertThrows(IllegalStateException.class, () -> StatusTransition.validate(PENDING, PENDING));
    }

    @Test
    void validate_null_상태는_IllegalArgumentException() {
        assertThrows(IllegalArgumentException.class, () -> StatusTransition.validate(null, PENDING));
        assertFalse(StatusTransition.canTransition(PENDING, null));
    }

    @Test
    void isActive_이름을_점유하는_상태() {
        assertTrue(PENDING.isActive());
        assertTrue(PROVISIONING.isActive());
        assertTrue(COMPLETED.isActive());
        assertFalse(FAILED.isActive());
        assertFalse(CANCELLED.isActive());
    }
}
