package com.weblarek.client;

import java.util.concurrent.atomic.AtomicReference;

/**
 * 메모리에만 있는 access token 보관소.
 * 디스크/로컬 스토리지에 쓰지 않는다. refresh 원문은 애초에 여기 없다 (HttpOnly 쿠키).
 */
public class SessionStore {

    private final AtomicReference<String> accessToken = new AtomicReference<>();

    public String get() {
        return accessToken.get();
    }

    public void set(String token) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("access token must not be blank");
        }
        accessToken.set(token);
    }

    public void clear() {
        accessToken.set(null);
    }

    public boolean isAuthenticated() {
        return accessToken.get() != null;
    }
}
