package com.weblarek.backend.auth.identity.dto;

import com.weblarek.backend.auth.domain.User;

/**
 * 세션이 새로 발급될 때(login / register / token)의 공통 응답 바디.
 * refresh 원문은 바디에 없다. 쿠키로만 나간다.
 */
public record AuthSessionResponse(boolean success, UserResponse user, String accessToken) {

    public static AuthSessionResponse of(User user, String accessToken) {
        return new AuthSessionResponse(true, UserResponse.from(user), accessToken);
    }
}
