package com.weblarek.backend.auth.token.web;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.weblarek.backend.auth.token.dto.LogoutResponse;
import com.weblarek.backend.auth.token.service.RefreshTokenService;
import com.weblarek.backend.auth.token.support.AuthCookieUtils;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * GET: /auth/logout
 *
 * 멱등:
 * - 쿠키 없음 / 미발급 쿠키 / 이미 폐기된 쿠키 => 모두 200
 * - 항상 쿠키 삭제 Set-Cookie를 내려준다
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth")
public class AuthLogoutController {

    private final RefreshTokenService refreshTokenService;
    private final AuthCookieUtils cookieUtils;

    @GetMapping("/logout")
    public LogoutResponse logout(HttpServletRequest request, HttpServletResponse response) {
        refreshTokenService.revoke(cookieUtils.readRefreshCookie(request));
        cookieUtils.clearRefreshCookie(response);
        return LogoutResponse.ok();
    }
}
