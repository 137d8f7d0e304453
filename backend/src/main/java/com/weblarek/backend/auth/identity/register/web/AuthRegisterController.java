package com.weblarek.backend.auth.identity.register.web;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.weblarek.backend.auth.identity.dto.AuthSessionResponse;
import com.weblarek.backend.auth.identity.register.dto.RegisterRequest;
import com.weblarek.backend.auth.identity.register.service.RegisterService;
import com.weblarek.backend.auth.identity.register.service.RegisterService.RegisterResult;
import com.weblarek.backend.auth.token.support.AuthCookieUtils;
import com.weblarek.backend.auth.token.support.SessionClient;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * 회원가입 API: 201 Created + 로그인과 같은 바디/쿠키
 */
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class AuthRegisterController {

    private final RegisterService registerService;
    private final AuthCookieUtils cookieUtils;

    @PostMapping("/register")
    public ResponseEntity<AuthSessionResponse> register(@RequestBody @Valid RegisterRequest req,
                                                        HttpServletRequest request,
                                                        HttpServletResponse response) {
        RegisterResult result = registerService.register(
                req.email(),
                req.password(),
                req.name(),
                SessionClient.from(request)
        );

        cookieUtils.setRefreshCookie(response, result.pair().refreshRaw(), result.pair().rememberMe());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(AuthSessionResponse.of(result.user(), result.pair().accessToken()));
    }
}
