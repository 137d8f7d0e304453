package com.weblarek.client.refresh;

import java.util.concurrent.CompletableFuture;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.weblarek.client.ClientConfig;
import com.weblarek.client.http.ApiRequest;
import com.weblarek.client.http.ApiResponse;
import com.weblarek.client.http.HttpTransport;

import lombok.RequiredArgsConstructor;

/**
 * GET /auth/token 으로 로테이션한다.
 * refresh 원문은 전송 계층의 쿠키 저장소가 알아서 싣는다. Authorization 헤더는 붙이지 않는다.
 */
@RequiredArgsConstructor
public class CookieTokenRefresher implements TokenRefresher {

    private final HttpTransport transport;
    private final ClientConfig config;
    private final ObjectMapper objectMapper;

    @Override
    public CompletableFuture<String> refresh() {
        return transport.send(ApiRequest.get(config.refreshPath()), null)
                .thenApply(this::extractAccessToken);
    }

    private String extractAccessToken(ApiResponse response) {
        if (!response.isSuccess()) {
            throw new RefreshFailedException(response.status(), "Refresh rejected with status " + response.status());
        }

        JsonNode json;
        try {
            json = objectMapper.readTree(response.body() == null ? "" : response.body());
        } catch (JsonProcessingException e) {
            throw new RefreshFailedException("Refresh response is not JSON", e);
        }

        String token = (json == null) ? null : json.path("accessToken").asText(null);
        if (token == null || token.isBlank()) {
            throw new RefreshFailedException(response.status(), "Refresh response has no accessToken");
        }
        return token;
    }
}
