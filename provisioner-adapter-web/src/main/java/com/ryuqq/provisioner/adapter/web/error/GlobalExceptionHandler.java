package com.ryuqq.provisioner.adapter.web.error;

import com.ryuqq.provisioner.core.error.CallTimeoutException;
import com.ryuqq.provisioner.core.error.CircuitBreakerOpenException;
import com.ryuqq.provisioner.core.error.ConflictException;
import com.ryuqq.provisioner.core.error.ExternalServiceException;
import com.ryuqq.provisioner.core.error.ProvisioningException;
import com.ryuqq.provisioner.core.error.RequestNotFoundException;
import com.ryuqq.provisioner.core.error.ValidationException;
import com.ryuqq.provisioner.core.model.RequestId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * 도메인 예외를 RFC 7807 ProblemDetail 로 변환.
 *
 * <p><strong>매핑:</strong></p>
 * <ul>
 *   <li>ValidationException, IllegalArgumentException → 400</li>
 *   <li>RequestNotFoundException → 404</li>
 *   <li>ConflictException → 409</li>
 *   <li>ExternalServiceException → 502</li>
 *   <li>CircuitBreakerOpenException → 503 + Retry-After</li>
 *   <li>CallTimeoutException → 504</li>
 * </ul>
 *
 * <p>요청 ID 가 있으면 {@code requestId} 속성으로 포함됩니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ProblemDetail> handleValidation(ValidationException e) {
        log.info("Rejected namespace request: {}", e.getViolations());
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, "Validation failed", e);
        problem.setProperty("violations", e.getViolations());
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleIllegalArgument(IllegalArgumentException e) {
        log.info("Bad request: {}", e.getMessage());
        return ResponseEntity.badRequest()
            .body(ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, e.getMessage()));
    }

    @ExceptionHandler(RequestNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleNotFound(RequestNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(problem(HttpStatus.NOT_FOUND, "Request not found", e));
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ProblemDetail> handleConflict(ConflictException e) {
        log.info("Conflict ({}): {}", e.getReason(), e.getMessage());
        ProblemDetail problem = problem(HttpStatus.CONFLICT, "Conflict", e);
        problem.setProperty("reason", e.getReason().name());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
    }

    @ExceptionHandler(CircuitBreakerOpenException.class)
    public ResponseEntity<ProblemDetail> handleCircuitOpen(CircuitBreakerOpenException e) {
        long retryAfter = Math.max(1, (e.getRemainingWait().toMillis() + 999) / 1000);
        log.warn("Rejected by open circuit breaker {} (retry after {}s)", e.getDependency(), retryAfter);
        ProblemDetail problem = problem(HttpStatus.SERVICE_UNAVAILABLE, "Dependency unavailable", e);
        problem.setProperty("dependency", e.getDependency());
        problem.setProperty("retryAfterSeconds", retryAfter);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfter))
            .body(problem);
    }

    @ExceptionHandler(CallTimeoutException.class)
    public ResponseEntity<ProblemDetail> handleTimeout(CallTimeoutException e) {
        log.warn("Call to {} timed out after {}", e.getDependency(), e.getTimeout());
        ProblemDetail problem = problem(HttpStatus.GATEWAY_TIMEOUT, "Dependency timed out", e);
        problem.setProperty("dependency", e.getDependency());
        return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT).body(problem);
    }

    @ExceptionHandler(ExternalServiceException.class)
    public ResponseEntity<ProblemDetail> handleExternal(ExternalServiceException e) {
        log.error("Call to {} failed: {}", e.getDependency(), e.getMessage());
        ProblemDetail problem = problem(HttpStatus.BAD_GATEWAY, "Dependency failed", e);
        problem.setProperty("dependency", e.getDependency());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(problem);
    }

    private static ProblemDetail problem(HttpStatus status, String title, ProvisioningException e) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, e.getMessage());
        problem.setTitle(title);
        e.getRequestId().map(RequestId::getValue).ifPresent(id -> problem.setProperty("requestId", id));
        return problem;
    }
}
