package com.ryuqq.provisioner.adapter.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ryuqq.provisioner.adapter.http.auth.AccessTokenProvider;
import com.ryuqq.provisioner.core.result.CallResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.CancellationException;

/**
 * JSON over HTTP 어댑터 공통 처리.
 *
 * <p><strong>응답 매핑:</strong></p>
 * <ul>
 *   <li>2xx → 본문을 {@link ResponseReader} 로 변환해 {@code Success}</li>
 *   <li>404 → {@code NotFound}</li>
 *   <li>401, 403, 토큰 조회 실패 → {@code Unauthenticated}</li>
 *   <li>그 외 상태 코드, I/O 오류, 본문 파싱 실패 → {@code ServiceError}</li>
 * </ul>
 *
 * <p>재시도하지 않습니다. 인터럽트되면 인터럽트 플래그를 복원하고 {@link CancellationException} 을 던집니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public abstract class JsonHttpAdapter {

    private static final Logger log = LoggerFactory.getLogger(JsonHttpAdapter.class);

    private static final int MAX_ERROR_BODY = 200;

    protected final HttpEndpointConfig endpoint;
    protected final ObjectMapper objectMapper;
    private final AccessTokenProvider tokenProvider;
    private final HttpClient httpClient;

    protected JsonHttpAdapter(HttpEndpointConfig endpoint, AccessTokenProvider tokenProvider, HttpClient httpClient) {
        if (endpoint == null) {
            throw new IllegalArgumentException("endpoint cannot be null");
        }
        if (tokenProvider == null) {
            throw new IllegalArgumentException("tokenProvider cannot be null");
        }
        this.endpoint = endpoint;
        this.tokenProvider = tokenProvider;
        this.httpClient = httpClient != null
            ? httpClient
            : HttpClient.newBuilder().connectTimeout(endpoint.connectTimeout()).build();
        this.objectMapper = defaultObjectMapper();
    }

    /**
     * 어댑터가 사용하는 ObjectMapper 설정.
     */
    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * 로그와 오류 메시지에 쓰는 의존성 이름.
     */
    protected abstract String dependencyName();

    protected <T> CallResult<T> get(String path, ResponseReader<T> reader) {
        return exchange("GET", path, null, reader);
    }

    protected <T> CallResult<T> post(String path, JsonNode body, ResponseReader<T> reader) {
        return exchange("POST", path, body, reader);
    }

    protected <T> CallResult<T> delete(String path, ResponseReader<T> reader) {
        return exchange("DELETE", path, null, reader);
    }

    private <T> CallResult<T> exchange(String method, String path, JsonNode body, ResponseReader<T> reader) {
        URI uri = endpoint.resolve(path);

        String token;
        try {
            token = tokenProvider.accessToken();
        } catch (RuntimeException e) {
            log.warn("{}: could not obtain access token for {} {}: {}", dependencyName(), method, uri, e.getMessage());
            return CallResult.unauthenticated("access token unavailable: " + e.getMessage());
        }

        HttpRequest.Builder request = HttpRequest.newBuilder(uri)
            .timeout(endpoint.requestTimeout())
            .header("Authorization", "Bearer " + token)
            .header("Accept", "application/json");
        try {
            if (body != null) {
                request.header("Content-Type", "application/json")
                    .method(method, HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)));
            } else {
                request.method(method, HttpRequest.BodyPublishers.noBody());
            }
        } catch (JsonProcessingException e) {
            return CallResult.serviceError("could not serialize request body", e);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            log.warn("{}: {} {} failed: {}", dependencyName(), method, uri, e.toString());
            return CallResult.serviceError(method + " " + path + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException(dependencyName() + " call " + method + " " + path + " was interrupted");
        }

        int status = response.statusCode();
        log.debug("{}: {} {} -> {}", dependencyName(), method, uri, status);
        if (status == 404) {
            return CallResult.notFound(method + " " + path + " returned 404");
        }
        if (status == 401 || status == 403) {
            return CallResult.unauthenticated("HTTP " + status + " from " + dependencyName());
        }
        if (status < 200 || status >= 300) {
            return CallResult.serviceError("HTTP " + status + " from " + dependencyName() + ": " + abbreviate(response.body()));
        }

        try {
            JsonNode json = response.body() == null || response.body().isBlank()
                ? MissingNode.getInstance()
                : objectMapper.readTree(response.body());
            return CallResult.success(reader.read(json));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("{}: unreadable response for {} {}: {}", dependencyName(), method, uri, e.getMessage());
            return CallResult.serviceError("unreadable response from " + dependencyName() + ": " + e.getMessage(), e);
        }
    }

    private static String abbreviate(String body) {
        if (body == null || body.isBlank()) {
            return "(empty body)";
        }
        return body.length() <= MAX_ERROR_BODY ? body : body.substring(0, MAX_ERROR_BODY) + "...";
    }

    /**
     * 2xx 응답 본문 변환.
     *
     * @param <T> 결과 타입
     */
    @FunctionalInterface
    protected interface ResponseReader<T> {

        /**
         * @param json 응답 본문 (본문이 없으면 MissingNode)
         * @throws IllegalArgumentException 필수 필드가 없는 경우
         */
        T read(JsonNode json) throws JsonProcessingException;
    }
}
