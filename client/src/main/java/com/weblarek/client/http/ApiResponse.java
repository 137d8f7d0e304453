package com.weblarek.client.http;

import java.util.List;
import java.util.Map;

public record ApiResponse(int status, String body, Map<String, List<String>> headers) {

    public ApiResponse {
        headers = (headers == null) ? Map.of() : headers;
    }

    public static ApiResponse of(int status, String body) {
        return new ApiResponse(status, body, Map.of());
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    public boolean isUnauthorized() {
        return status == 401;
    }
}
