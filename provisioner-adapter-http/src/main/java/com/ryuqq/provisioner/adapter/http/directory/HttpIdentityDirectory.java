package com.ryuqq.provisioner.adapter.http.directory;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.provisioner.adapter.http.HttpEndpointConfig;
import com.ryuqq.provisioner.adapter.http.JsonHttpAdapter;
import com.ryuqq.provisioner.adapter.http.auth.AccessTokenProvider;
import com.ryuqq.provisioner.core.result.CallResult;
import com.ryuqq.provisioner.core.spi.DirectoryEntry;
import com.ryuqq.provisioner.core.spi.IdentityDirectory;

import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;

/**
 * 디렉터리 서비스 REST API 어댑터.
 *
 * <p><strong>경로:</strong></p>
 * <ul>
 *   <li>{@code GET /users/{idOrUpn}?$select=id,displayName,userPrincipalName}</li>
 *   <li>{@code GET /groups/{id}?$select=id,displayName}</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class HttpIdentityDirectory extends JsonHttpAdapter implements IdentityDirectory {

    static final String USER_SELECT = "?$select=id,displayName,userPrincipalName";
    static final String GROUP_SELECT = "?$select=id,displayName";

    public HttpIdentityDirectory(HttpEndpointConfig endpoint, AccessTokenProvider tokenProvider) {
        this(endpoint, tokenProvider, null);
    }

    public HttpIdentityDirectory(HttpEndpointConfig endpoint, AccessTokenProvider tokenProvider, HttpClient httpClient) {
        super(endpoint, tokenProvider, httpClient);
    }

    @Override
    public CallResult<DirectoryEntry> findUser(String idOrPrincipalName) {
        return get("/users/" + encode(idOrPrincipalName) + USER_SELECT, HttpIdentityDirectory::readEntry);
    }

    @Override
    public CallResult<DirectoryEntry> findGroup(String objectId) {
        return get("/groups/" + encode(objectId) + GROUP_SELECT, HttpIdentityDirectory::readEntry);
    }

    @Override
    protected String dependencyName() {
        return "identity-directory";
    }

    private static DirectoryEntry readEntry(JsonNode json) {
        String id = json.path("id").asText("");
        if (id.isBlank()) {
            throw new IllegalArgumentException("directory response has no id");
        }
        JsonNode upn = json.path("userPrincipalName");
        return new DirectoryEntry(
            id,
            json.path("displayName").asText(null),
            upn.isTextual() ? upn.asText() : null
        );
    }

    private static String encode(String segment) {
        if (segment == null || segment.isBlank()) {
            throw new IllegalArgumentException("identifier cannot be null or blank");
        }
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
