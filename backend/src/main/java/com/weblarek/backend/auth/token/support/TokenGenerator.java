package com.weblarek.backend.auth.token.support;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

/**
 * Refresh Token 원문 생성기
 *
 * - SecureRandom 48 bytes -> Base64 URL-safe, padding 제거 = 항상 64자
 * - 쿠키/헤더에 안전한 문자셋(-, _)만 쓴다.
 */
@Component
@RequiredArgsConstructor
public class TokenGenerator {

    private static final int TOKEN_BYTES = 48;
    public static final int TOKEN_LENGTH = 64;

    private static final Pattern TOKEN_PATTERN = Pattern.compile("^[A-Za-z0-9_-]{" + TOKEN_LENGTH + "}$");

    private final SecureRandom secureRandom;

    public String generateRefreshToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /**
     * 우리가 발급했을 수 있는 모양인지 (DB 조회 전에 쓰레기 값을 걸러낸다).
     * JWT나 임의 문자열이 쿠키에 들어오면 여기서 false.
     */
    public static boolean isWellFormed(String raw) {
        return raw != null && TOKEN_PATTERN.matcher(raw).matches();
    }
}
