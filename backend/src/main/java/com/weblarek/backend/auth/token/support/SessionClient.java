package com.weblarek.backend.auth.token.support;

import org.springframework.http.HttpHeaders;

import jakarta.servlet.http.HttpServletRequest;

/**
 * 세션을 만든 클라이언트 정보 (refresh_tokens.user_agent / ip_address 텔레메트리용)
 */
public record SessionClient(String userAgent, String ipAddress) {

    public static final SessionClient UNKNOWN = new SessionClient(null, null);

    public static SessionClient from(HttpServletRequest request) {
        if (request == null) return UNKNOWN;
        return new SessionClient(request.getHeader(HttpHeaders.USER_AGENT), request.getRemoteAddr());
    }
}
