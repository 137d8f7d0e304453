package com.weblarek.client.http;

import java.util.Map;
import java.util.Objects;

/**
 * 게이트웨이를 지나는 요청 한 건. 재전송(replay)할 수 있도록 불변이다.
 * body는 JSON 문자열 (없으면 null).
 */
public record ApiRequest(String method, String path, String body, Map<String, String> headers) {

    public ApiRequest {
        Objects.requireNonNull(method, "method must not be null");
        if (path == null || !path.startsWith("/")) {
            throw new IllegalArgumentException("path must start with '/': " + path);
        }
        headers = (headers == null) ? Map.of() : Map.copyOf(headers);
    }

    public static ApiRequest get(String path) {
        return new ApiRequest("GET", path, null, Map.of());
    }

    public static ApiRequest post(String path, String jsonBody) {
        return new ApiRequest("POST", path, jsonBody, Map.of());
    }

    public static ApiRequest patch(String path, String jsonBody) {
        return new ApiRequest("PATCH", path, jsonBody, Map.of());
    }

    public static ApiRequest delete(String path) {
        return new ApiRequest("DELETE", path, null, Map.of());
    }
}
