package com.weblarek.backend.auth.identity.me.web;

import java.util.List;

import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.weblarek.backend.auth.identity.dto.UserResponse;
import com.weblarek.backend.auth.identity.me.dto.CurrentUserResponse;
import com.weblarek.backend.auth.identity.me.dto.UpdateMeRequest;
import com.weblarek.backend.auth.identity.me.service.MeService;
import com.weblarek.backend.security.AuthPrincipal;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * [현재 사용자 API]
 *
 * - JwtAuthenticationFilter가 Access Token을 검증하면 principal(AuthPrincipal)이 주입된다.
 * - 토큰이 없으면 SecurityConfig에서 이미 401 AUTH_REQUIRED로 막힌다.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth")
public class AuthMeController {

    private final MeService meService;

    @GetMapping("/user")
    public CurrentUserResponse currentUser(@AuthenticationPrincipal AuthPrincipal principal) {
        return CurrentUserResponse.of(meService.me(principal));
    }

    @GetMapping("/user/roles")
    public List<String> roles(@AuthenticationPrincipal AuthPrincipal principal) {
        return meService.roles(principal);
    }

    @PatchMapping("/me")
    public UserResponse updateMe(@AuthenticationPrincipal AuthPrincipal principal,
                                 @Valid @RequestBody UpdateMeRequest req) {
        return meService.updateMe(principal, req.name(), req.email());
    }
}
