package com.ryuqq.provisioner.core.result;

import java.util.function.Function;

/**
 * 외부 의존성 호출 결과.
 *
 * <p>CallResult 는 네 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Success}: 정상 응답</li>
 *   <li>{@link NotFound}: 대상이 존재하지 않음 (정상적인 부정 결과)</li>
 *   <li>{@link Unauthenticated}: 자격 증명/토큰 문제</li>
 *   <li>{@link ServiceError}: 전송 실패 또는 서버 오류</li>
 * </ul>
 *
 * <p><strong>서킷 브레이커 집계:</strong> {@link ServiceError} 와 {@link Unauthenticated} 만 실패로 집계되며,
 * {@link NotFound} 는 의존성이 정상 응답한 것으로 간주합니다 ({@link #countsAsFailure()}).</p>
 *
 * <p><strong>분기 예시:</strong></p>
 * <pre>
 * CallResult&lt;DirectoryEntry&gt; result = directory.findUser(upn);
 * if (result instanceof Success&lt;DirectoryEntry&gt; success) {
 *     return success.value();
 * } else if (result instanceof NotFound&lt;DirectoryEntry&gt;) {
 *     ...
 * }
 * </pre>
 *
 * @param <T> 성공 값 타입
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public sealed interface CallResult<T> permits Success, NotFound, Unauthenticated, ServiceError {

    static <T> CallResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> CallResult<T> notFound(String detail) {
        return new NotFound<>(detail);
    }

    static <T> CallResult<T> unauthenticated(String detail) {
        return new Unauthenticated<>(detail);
    }

    static <T> CallResult<T> serviceError(String detail) {
        return new ServiceError<>(detail, null);
    }

    static <T> CallResult<T> serviceError(String detail, Throwable cause) {
        return new ServiceError<>(detail, cause);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default boolean isNotFound() {
        return this instanceof NotFound;
    }

    /**
     * 서킷 브레이커가 이 결과를 실패로 집계해야 하는지 여부.
     *
     * @return ServiceError 또는 Unauthenticated 이면 true
     */
    default boolean countsAsFailure() {
        return this instanceof ServiceError || this instanceof Unauthenticated;
    }

    /**
     * 성공 값 변환. 실패 결과는 같은 종류, 같은 상세 정보로 유지됩니다.
     *
     * @param mapper 성공 값 변환 함수
     * @param <R> 변환 결과 타입
     * @return 변환된 결과
     */
    <R> CallResult<R> map(Function<? super T, ? extends R> mapper);

    /**
     * 사람이 읽을 수 있는 결과 설명.
     */
    String describe();
}
