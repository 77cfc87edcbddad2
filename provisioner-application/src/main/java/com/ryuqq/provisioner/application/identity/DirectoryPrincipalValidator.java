package com.ryuqq.provisioner.application.identity;

import com.ryuqq.provisioner.core.error.CircuitBreakerOpenException;
import com.ryuqq.provisioner.core.error.ExternalServiceException;
import com.ryuqq.provisioner.core.model.IdentityPrincipal;
import com.ryuqq.provisioner.core.model.PrincipalType;
import com.ryuqq.provisioner.core.protection.CircuitBreaker;
import com.ryuqq.provisioner.core.result.CallResult;
import com.ryuqq.provisioner.core.result.NotFound;
import com.ryuqq.provisioner.core.spi.DirectoryEntry;
import com.ryuqq.provisioner.core.spi.IdentityDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;

/**
 * {@link IdentityDirectory} 기반 주체 검증기.
 *
 * <p>모든 디렉터리 호출은 디렉터리 전용 서킷 브레이커를 거칩니다.
 * 브레이커 거부, 호출 타임아웃, 전송 실패는 모두 {@code ServiceError} 로 변환됩니다.</p>
 *
 * <p><strong>validateById 폴백 규칙:</strong></p>
 * <ul>
 *   <li>사용자 조회 Success → 사용자 주체</li>
 *   <li>사용자 조회 NotFound → 그룹 조회 결과</li>
 *   <li>사용자 조회 ServiceError / Unauthenticated → 그대로 반환 (그룹 조회 안 함)</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class DirectoryPrincipalValidator implements PrincipalValidator {

    private static final Logger log = LoggerFactory.getLogger(DirectoryPrincipalValidator.class);

    private final IdentityDirectory directory;
    private final CircuitBreaker breaker;

    public DirectoryPrincipalValidator(IdentityDirectory directory, CircuitBreaker breaker) {
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
        }
        if (breaker == null) {
            throw new IllegalArgumentException("breaker cannot be null");
        }
        this.directory = directory;
        this.breaker = breaker;
    }

    @Override
    public CallResult<IdentityPrincipal> validateById(String objectId) {
        requireIdentifier(objectId, "objectId");
        log.debug("Validating principal by id {}", objectId);

        CallResult<IdentityPrincipal> user = validateUser(objectId);
        if (!(user instanceof NotFound)) {
            return user;
        }
        log.debug("No user with id {}, trying groups", objectId);
        return validateGroup(objectId);
    }

    @Override
    public CallResult<IdentityPrincipal> validateUser(String principalName) {
        requireIdentifier(principalName, "principalName");
        CallResult<IdentityPrincipal> result = call(() -> directory.findUser(principalName))
            .map(entry -> IdentityPrincipal.verified(entry, PrincipalType.USER));
        logResult("user", principalName, result);
        return result;
    }

    @Override
    public CallResult<IdentityPrincipal> validateGroup(String objectId) {
        requireIdentifier(objectId, "objectId");
        CallResult<IdentityPrincipal> result = call(() -> directory.findGroup(objectId))
            .map(entry -> IdentityPrincipal.verified(entry, PrincipalType.GROUP));
        logResult("group", objectId, result);
        return result;
    }

    private CallResult<DirectoryEntry> call(Callable<CallResult<DirectoryEntry>> lookup) {
        try {
            return breaker.execute(lookup, CallResult::countsAsFailure);
        } catch (CircuitBreakerOpenException e) {
            return CallResult.serviceError(
                "Identity directory unavailable, retry in " + e.getRemainingWait().toSeconds() + "s", e
            );
        } catch (ExternalServiceException e) {
            return CallResult.serviceError(e.getMessage(), e);
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            return CallResult.serviceError("Identity directory call failed: " + e.getMessage(), e);
        }
    }

    private void logResult(String kind, String identifier, CallResult<IdentityPrincipal> result) {
        String masked = PrincipalMasker.mask(identifier);
        if (result.isSuccess()) {
            log.info("Validated {} principal {}", kind, masked);
        } else if (result.isNotFound()) {
            log.info("No {} principal {} in directory", kind, masked);
        } else {
            log.warn("Directory lookup of {} {} failed: {}", kind, masked, result.describe());
        }
    }

    private static void requireIdentifier(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
    }
}
