package com.weblarek.backend.auth.token.web;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.weblarek.backend.auth.identity.dto.AuthSessionResponse;
import com.weblarek.backend.auth.token.service.RefreshTokenService;
import com.weblarek.backend.auth.token.service.RefreshTokenService.RotateResult;
import com.weblarek.backend.auth.token.support.AuthCookieUtils;
import com.weblarek.backend.auth.token.support.SessionClient;
import com.weblarek.backend.global.ApiException;
import com.weblarek.backend.global.ErrorCode;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * GET: /auth/token
 *
 * HttpOnly 쿠키의 refresh 원문으로 로테이션한다.
 * 성공:
 * - 새 refresh 쿠키 (TTL은 이전 세션의 rememberMe 정책을 따른다)
 * - 새 access token + user 바디
 * 실패(어떤 이유든):
 * - 쿠키 삭제 + 401. 클라이언트는 이걸 강제 로그아웃 신호로 본다.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth")
public class AuthTokenController {

    private final RefreshTokenService refreshTokenService;
    private final AuthCookieUtils cookieUtils;

    @GetMapping("/token")
    public AuthSessionResponse token(HttpServletRequest request, HttpServletResponse response) {
        String refreshRaw = cookieUtils.readRefreshCookie(request);

        RotateResult result;
        try {
            result = refreshTokenService.rotate(refreshRaw, SessionClient.from(request));
        } catch (ApiException e) {
            cookieUtils.clearRefreshCookie(response);
            throw e;
        } catch (RuntimeException e) {
            cookieUtils.clearRefreshCookie(response);
            log.error("refresh 로테이션 중 예기치 못한 오류", e);
            throw new ApiException(ErrorCode.REFRESH_INVALID);
        }

        cookieUtils.setRefreshCookie(response, result.pair().refreshRaw(), result.pair().rememberMe());
        return AuthSessionResponse.of(result.user(), result.pair().accessToken());
    }
}
