package com.weblarek.backend.auth.identity.login.dto;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.weblarek.backend.global.jackson.NormalizedEmailDeserializer;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

/**
 * [로그인 요청 DTO]
 * - email은 역직렬화 단계에서 trim + 소문자화된다.
 * - 길이 정책은 가입 때만 본다. 로그인은 빈 값만 거른다.
 */
public record LoginRequest(

        @JsonDeserialize(using = NormalizedEmailDeserializer.class)
        @Email
        @NotBlank
        String email,

        @NotBlank
        String password,

        Boolean rememberMe
) {
    public boolean rememberMeOrFalse() {
        return Boolean.TRUE.equals(rememberMe);
    }
}
