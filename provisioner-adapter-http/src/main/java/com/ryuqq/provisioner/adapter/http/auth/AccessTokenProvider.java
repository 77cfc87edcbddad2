package com.ryuqq.provisioner.adapter.http.auth;

/**
 * Supplies the bearer token for outbound calls.
 *
 * <p>Called once per request. Implementations that refresh tokens must be thread-safe.
 * A thrown exception is reported to the caller as an {@code Unauthenticated} result.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface AccessTokenProvider {

    /**
     * @return the current access token (without the {@code Bearer} prefix)
     */
    String accessToken();
}
