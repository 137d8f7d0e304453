package com.weblarek.backend.auth.identity.login.web;

import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.weblarek.backend.auth.identity.dto.AuthSessionResponse;
import com.weblarek.backend.auth.identity.login.dto.LoginRequest;
import com.weblarek.backend.auth.identity.login.service.LoginService;
import com.weblarek.backend.auth.identity.login.service.LoginService.LoginResult;
import com.weblarek.backend.auth.token.support.AuthCookieUtils;
import com.weblarek.backend.auth.token.support.SessionClient;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * POST /auth/login
 *
 * - accessToken: 바디
 * - refreshToken: HttpOnly 쿠키
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth")
public class AuthLoginController {

    private final LoginService loginService;
    private final AuthCookieUtils cookieUtils;

    @PostMapping("/login")
    public AuthSessionResponse login(@Valid @RequestBody LoginRequest req,
                                     HttpServletRequest request,
                                     HttpServletResponse response) {

        LoginResult result = loginService.login(
                req.email(),
                req.password(),
                req.rememberMeOrFalse(),
                SessionClient.from(request)
        );

        cookieUtils.setRefreshCookie(response, result.pair().refreshRaw(), result.pair().rememberMe());
        return AuthSessionResponse.of(result.user(), result.pair().accessToken());
    }
}
