package com.weblarek.backend.auth.token.support;

import java.time.Duration;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

import com.weblarek.backend.auth.config.AuthProperties;
import com.weblarek.backend.auth.config.AuthProperties.Refresh;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * refreshToken 쿠키 발급/만료/판독.
 *
 * 발급과 만료는 같은 속성 묶음(HttpOnly, Secure, Path, SameSite)으로 나간다. 하나라도 다르면
 * 브라우저는 별개의 쿠키로 보고 옛 값을 남긴다.
 * 쿠키 수명은 서버 쪽 row의 expires_at 과 같은 TTL을 쓴다.
 */
@Component
@RequiredArgsConstructor
public class AuthCookieUtils {

    // 만료 응답에 싣는 자리표시 값. 들어와도 refresh 없음으로 본다.
    private static final String CLEARED_VALUE = "deleted";

    private final AuthProperties props;

    /** 요청에 실린 refresh 원문. 없거나 공백이거나 만료 자리표시면 null */
    public String readRefreshCookie(HttpServletRequest request) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null) return null;

        String name = props.refresh().cookieName();
        for (Cookie cookie : cookies) {
            if (!name.equals(cookie.getName()) || cookie.getValue() == null) continue;

            String value = cookie.getValue().trim();
            if (!value.isEmpty() && !CLEARED_VALUE.equals(value)) {
                return value;
            }
        }
        return null;
    }

    public void setRefreshCookie(HttpServletResponse response, String refreshRaw, boolean rememberMe) {
        if (refreshRaw == null || refreshRaw.isBlank()) return;
        write(response, refreshRaw, ttlFor(rememberMe));
    }

    public void clearRefreshCookie(HttpServletResponse response) {
        write(response, CLEARED_VALUE, Duration.ZERO);
    }

    private Duration ttlFor(boolean rememberMe) {
        Refresh r = props.refresh();
        return Duration.ofSeconds(rememberMe ? r.rememberMeSeconds() : r.sessionTtlSeconds());
    }

    private void write(HttpServletResponse response, String value, Duration maxAge) {
        Refresh r = props.refresh();
        ResponseCookie cookie = ResponseCookie.from(r.cookieName(), value)
                .httpOnly(true)
                .secure(r.cookieSecure())
                .path(r.cookiePath())
                .sameSite(r.cookieSameSite().name())
                .maxAge(maxAge)
                .build();
        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
    }
}
