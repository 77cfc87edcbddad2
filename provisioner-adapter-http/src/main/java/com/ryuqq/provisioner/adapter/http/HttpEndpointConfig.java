package com.ryuqq.provisioner.adapter.http;

import java.net.URI;
import java.time.Duration;

/**
 * HTTP 엔드포인트 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>baseUrl: 서비스 기본 URL (끝의 "/" 는 제거)</li>
 *   <li>requestTimeout: 요청 단위 타임아웃 (기본 10초)</li>
 *   <li>connectTimeout: 연결 타임아웃 (기본 5초)</li>
 * </ul>
 *
 * <p>호출 전체 시간의 상한은 서킷 브레이커의 callTimeout 이 정하며,
 * requestTimeout 은 그보다 같거나 짧게 두는 것이 일반적입니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 * @param baseUrl 기본 URL (http 또는 https)
 * @param requestTimeout 요청 타임아웃 (양수)
 * @param connectTimeout 연결 타임아웃 (양수)
 */
public record HttpEndpointConfig(
    String baseUrl,
    Duration requestTimeout,
    Duration connectTimeout
) {

    /**
     * 기본 설정 생성자 (http://localhost:2746, 10초, 5초).
     */
    public HttpEndpointConfig() {
        this("http://localhost:2746", Duration.ofSeconds(10), Duration.ofSeconds(5));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public HttpEndpointConfig {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl cannot be null or blank");
        }
        baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        String scheme = URI.create(baseUrl).getScheme();
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            throw new IllegalArgumentException("baseUrl must be an http(s) URL (current: " + baseUrl + ")");
        }
        if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()) {
            throw new IllegalArgumentException("requestTimeout must be positive (current: " + requestTimeout + ")");
        }
        if (connectTimeout == null || connectTimeout.isZero() || connectTimeout.isNegative()) {
            throw new IllegalArgumentException("connectTimeout must be positive (current: " + connectTimeout + ")");
        }
    }

    /**
     * 기본 타임아웃으로 설정 생성.
     */
    public static HttpEndpointConfig of(String baseUrl) {
        return new HttpEndpointConfig().withBaseUrl(baseUrl);
    }

    public HttpEndpointConfig withBaseUrl(String baseUrl) {
        return new HttpEndpointConfig(baseUrl, requestTimeout, connectTimeout);
    }

    public HttpEndpointConfig withRequestTimeout(Duration requestTimeout) {
        return new HttpEndpointConfig(baseUrl, requestTimeout, connectTimeout);
    }

    public HttpEndpointConfig withConnectTimeout(Duration connectTimeout) {
        return new HttpEndpointConfig(baseUrl, requestTimeout, connectTimeout);
    }

    /**
     * 기본 URL 에 경로를 붙인 URI.
     */
    public URI resolve(String path) {
        return URI.create(baseUrl + (path.startsWith("/") ? path : "/" + path));
    }
}
