package com.weblarek.backend.auth.admin.web;

import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.weblarek.backend.auth.admin.dto.SessionRevokeResponse;
import com.weblarek.backend.auth.token.domain.RefreshRevokeReason;
import com.weblarek.backend.auth.token.service.RefreshTokenService;
import com.weblarek.backend.security.AuthPrincipal;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 관리자: 특정 사용자의 모든 세션 강제 종료
 * - ROLE_ADMIN 검사는 SecurityConfig(/auth/admin/**)가 한다.
 * - 이미 발급된 access token은 만료 시각까지 살아 있다.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth/admin")
public class AdminSessionController {

    private final RefreshTokenService refreshTokenService;

    @DeleteMapping("/users/{userId}/sessions")
    public SessionRevokeResponse revokeSessions(@AuthenticationPrincipal AuthPrincipal admin,
                                                @PathVariable Long userId) {
        log.info("관리자 세션 강제 종료 요청: adminId={}, targetUserId={}", admin.userId(), userId);
        int revoked = refreshTokenService.revokeAll(userId, RefreshRevokeReason.ADMIN);
        return new SessionRevokeResponse(true, revoked);
    }
}
