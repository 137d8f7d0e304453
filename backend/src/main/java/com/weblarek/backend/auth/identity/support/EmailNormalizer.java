package com.weblarek.backend.auth.identity.support;

import java.util.Locale;

/**
 * 이메일 정규화 규칙의 단일 소스 (users.email 유니크 제약이 이 규칙을 전제로 한다).
 */
public final class EmailNormalizer {

    private EmailNormalizer() {}

    // trim + 소문자
    public static String normalize(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }
}
