package com.weblarek.backend.auth.identity.register.dto;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.weblarek.backend.global.jackson.NormalizedEmailDeserializer;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * 회원가입 요청
 * - 1차 입력 검증(@Valid)만 담당한다. 중복 이메일은 서비스가 본다.
 */
public record RegisterRequest(

        @JsonDeserialize(using = NormalizedEmailDeserializer.class)
        @NotBlank(message = "이메일은 필수입니다.")
        @Email(message = "이메일 형식이 올바르지 않습니다.")
        String email,

        @NotBlank(message = "비밀번호는 필수입니다.")
        @Size(min = 8, max = 72, message = "비밀번호는 8~72자여야 합니다.")
        String password,

        @NotBlank(message = "이름은 필수입니다.")
        @Size(min = 2, max = 30, message = "이름은 2~30자여야 합니다.")
        String name
) {
}
