package com.weblarek.backend.security;

import com.weblarek.backend.auth.domain.UserRole;

/**
 * SecurityContext에 들어가는 인증된 사용자 최소 정보.
 * JwtAuthenticationFilter가 access token 검증 성공 시 만든다. (DB 조회 없음)
 */
public record AuthPrincipal(Long userId, UserRole role) {

    public AuthPrincipal {
        if (userId == null) throw new IllegalArgumentException("userId must not be null");
        if (role == null) throw new IllegalArgumentException("role must not be null");
    }

    /** Spring Security 권한 문자열 규칙(ROLE_*) */
    public String authority() {
        return "ROLE_" + role.name();
    }
}
