package com.weblarek.client.api;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.weblarek.client.RequestGateway;
import com.weblarek.client.SessionStore;
import com.weblarek.client.api.dto.AuthSession;
import com.weblarek.client.api.dto.AuthUser;
import com.weblarek.client.http.ApiRequest;
import com.weblarek.client.http.ApiResponse;
import com.weblarek.client.http.HttpTransport;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 백엔드 /auth/** 에 대한 타입 API. 모든 호출은 RequestGateway를 지난다.
 *
 * - login / register 성공 시 access token을 SessionStore에 저장한다.
 * - logout은 서버 호출 성공 여부와 상관없이 로컬 상태를 비운다.
 */
@Slf4j
@RequiredArgsConstructor
public class AuthApi {

    private final RequestGateway gateway;
    private final SessionStore sessionStore;
    private final HttpTransport transport;
    private final ObjectMapper objectMapper;

    public CompletableFuture<AuthSession> login(String email, String password, boolean rememberMe) {
        ObjectNode body = objectMapper.createObjectNode()
                .put("email", email)
                .put("password", password)
                .put("rememberMe", rememberMe);

        return gateway.execute(ApiRequest.post("/auth/login", body.toString()))
                .thenApply(response -> storeSession(read(response, AuthSession.class)));
    }

    public CompletableFuture<AuthSession> register(String email, String password, String name) {
        ObjectNode body = objectMapper.createObjectNode()
                .put("email", email)
                .put("password", password)
                .put("name", name);

        return gateway.execute(ApiRequest.post("/auth/register", body.toString()))
                .thenApply(response -> storeSession(read(response, AuthSession.class)));
    }

    public CompletableFuture<AuthUser> currentUser() {
        return gateway.execute(ApiRequest.get("/auth/user"))
                .thenApply(response -> treeToValue(readTree(response).path("user"), AuthUser.class));
    }

    public CompletableFuture<List<String>> roles() {
        JavaType listOfString = objectMapper.getTypeFactory().constructCollectionType(List.class, String.class);
        return gateway.execute(ApiRequest.get("/auth/user/roles"))
                .thenApply(response -> {
                    JsonNode tree = readTree(response);
                    return objectMapper.convertValue(tree, listOfString);
                });
    }

    // null 인 필드는 보내지 않는다 (= 변경 없음)
    public CompletableFuture<AuthUser> updateMe(String name, String email) {
        ObjectNode body = objectMapper.createObjectNode();
        if (name != null) body.put("name", name);
        if (email != null) body.put("email", email);

        return gateway.execute(ApiRequest.patch("/auth/me", body.toString()))
                .thenApply(response -> read(response, AuthUser.class));
    }

    public CompletableFuture<Void> logout() {
        return gateway.execute(ApiRequest.get("/auth/logout"))
                .handle((response, error) -> {
                    sessionStore.clear();
                    transport.clearCookies();
                    if (error != null) {
                        log.warn("logout 호출 실패, 로컬 세션만 정리: {}", error.toString());
                    } else if (!response.isSuccess()) {
                        log.warn("logout 응답 status={}, 로컬 세션만 정리", response.status());
                    }
                    return null;
                });
    }

    // ========= helpers =========

    private AuthSession storeSession(AuthSession session) {
        if (session.accessToken() == null || session.accessToken().isBlank()) {
            throw new ApiCallException(200, null, "Session response has no accessToken");
        }
        sessionStore.set(session.accessToken());
        return session;
    }

    private <T> T read(ApiResponse response, Class<T> type) {
        return treeToValue(readTree(response), type);
    }

    private <T> T treeToValue(JsonNode node, Class<T> type) {
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new ApiCallException(-1, null, "Unexpected response shape: " + e.getOriginalMessage());
        }
    }

    private JsonNode readTree(ApiResponse response) {
        if (!response.isSuccess()) {
            throw toApiCallException(response);
        }
        try {
            return objectMapper.readTree(response.body() == null ? "" : response.body());
        } catch (JsonProcessingException e) {
            throw new ApiCallException(response.status(), null, "Response is not JSON: " + e.getOriginalMessage());
        }
    }

    private ApiCallException toApiCallException(ApiResponse response) {
        String code = null;
        String message = "HTTP " + response.status();
        try {
            JsonNode error = objectMapper.readTree(response.body() == null ? "" : response.body());
            if (error != null) {
                code = error.path("code").asText(null);
                message = error.path("message").asText(message);
            }
        } catch (JsonProcessingException e) {
            log.debug("에러 바디 파싱 실패: status={}", response.status());
        }
        return new ApiCallException(response.status(), code, message);
    }
}
