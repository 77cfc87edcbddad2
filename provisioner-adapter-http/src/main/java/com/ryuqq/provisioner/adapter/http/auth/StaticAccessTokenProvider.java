package com.ryuqq.provisioner.adapter.http.auth;

/**
 * 설정값으로 받은 고정 토큰.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class StaticAccessTokenProvider implements AccessTokenProvider {

    private final String token;

    public StaticAccessTokenProvider(String token) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("token cannot be null or blank");
        }
        this.token = token;
    }

    @Override
    public String accessToken() {
        return token;
    }

    @Override
    public String toString() {
        return "StaticAccessTokenProvider{token=***}";
    }
}
