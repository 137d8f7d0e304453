package com.weblarek.backend.auth.identity.dto;

import java.util.List;
import java.util.Objects;

import com.weblarek.backend.auth.domain.User;

/**
 * 응답에 실리는 사용자 표현: {id, email, name, roles[]}
 * - passwordHash/status 같은 내부 필드는 절대 내보내지 않는다.
 */
public record UserResponse(
        Long id,
        String email,
        String name,
        List<String> roles
) {

    public static UserResponse from(User user) {
        Objects.requireNonNull(user, "user must not be null");

        return new UserResponse(
                user.getId(),
                user.getEmail(),
                user.getName(),
                List.of(user.getRole().name())
        );
    }
}
