package com.weblarek.backend.auth.identity.me.dto;

import com.weblarek.backend.auth.identity.dto.UserResponse;

// GET /auth/user 바디: {user, success}
public record CurrentUserResponse(UserResponse user, boolean success) {

    public static CurrentUserResponse of(UserResponse user) {
        return new CurrentUserResponse(user, true);
    }
}
