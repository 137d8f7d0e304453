package com.weblarek.backend.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/*
  application.yml 의 app.auth.* 값을 타입 안전하게 바인딩한다. (@Validated: 규칙 위반이면 부팅 실패)

  app:
    auth:
      jwt:
        issuer: weblarek
        access-ttl-seconds: 600
        secret: ${APP_AUTH_JWT_SECRET}

      refresh:
        cookie-name: refreshToken
        cookie-path: /auth
        cookie-same-site: Strict
        cookie-secure: false        # 로컬은 HTTPS가 아니므로 false
        remember-me-seconds: 2592000
        session-ttl-seconds: 604800
        hash-secret: ${APP_AUTH_REFRESH_HASH_SECRET}
        revoke-all-on-reuse: false
 */
@Validated
@ConfigurationProperties(prefix = "app.auth")
public record AuthProperties(@Valid @NotNull Jwt jwt,
                             @Valid @NotNull Refresh refresh) {

    /**
     * Access Token(JWT) 설정
     * - issuer: 토큰 발급자 식별자 (검증 시 requireIssuer)
     * - accessTtlSeconds: Access Token 수명 (짧게)
     * - secret: HS256 서명 키
     */
    public record Jwt(
        @NotBlank String issuer,
        @Min(1) long accessTtlSeconds,
        @NotBlank @Size(min = 32) String secret
    ) {}

    /**
     * Refresh Token + 쿠키 설정
     * - cookieName / cookiePath / cookieSameSite / cookieSecure: Set-Cookie 속성
     * - rememberMeSeconds: rememberMe=true 세션 TTL
     * - sessionTtlSeconds: rememberMe=false 세션 TTL
     * - hashSecret: DB 저장용 HMAC 키 (DB만 유출돼서는 원문 대조가 불가능하게)
     * - revokeAllOnReuse: 이미 로테이션된 토큰이 다시 오면 그 사용자의 모든 세션을 끊을지
     */
    public record Refresh(
            @NotBlank String cookieName,

            @NotBlank @Pattern(regexp = "^/.*", message = "cookiePath must start with '/'")
            String cookiePath,

            @NotNull SameSite cookieSameSite,

            boolean cookieSecure,

            @Min(1) long rememberMeSeconds,

            @Min(1) long sessionTtlSeconds,

            @NotBlank @Size(min = 32) String hashSecret,

            boolean revokeAllOnReuse
    ) {}

    // SameSite는 오타가 치명적이라 enum으로 고정
    public enum SameSite {
        Lax, Strict, None
    }
}
