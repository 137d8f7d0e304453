package com.weblarek.backend.auth.identity.me.dto;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.weblarek.backend.global.jackson.NormalizedEmailDeserializer;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;

/**
 * PATCH /auth/me
 * - 보낸 필드만 바꾼다. (null = 변경 없음)
 */
public record UpdateMeRequest(

        @Size(min = 2, max = 30, message = "이름은 2~30자여야 합니다.")
        String name,

        @JsonDeserialize(using = NormalizedEmailDeserializer.class)
        @Email(message = "이메일 형식이 올바르지 않습니다.")
        String email
) {
}
