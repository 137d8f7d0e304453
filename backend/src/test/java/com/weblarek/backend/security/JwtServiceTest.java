package com.weblarek.backend.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.weblarek.backend.auth.config.AuthProperties;
import com.weblarek.backend.auth.domain.UserRole;
import com.weblarek.backend.infra.MutableClock;

@DisplayName("[Security] JwtService 단위 테스트")
class JwtServiceTest {

    private static final String SECRET = "unit-test-jwt-secret-0123456789-abcdef";

    private MutableClock clock;
    private JwtService jwtService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
        jwtService = new JwtService(props("weblarek", SECRET), clock);
    }

    @Test
    @DisplayName("발급한 토큰을 검증하면 userId/role 이 그대로 돌아온다")
    void issue_then_verify() {
        String token = jwtService.issueAccessToken(42L, UserRole.ADMIN);

        AuthPrincipal principal = jwtService.verifyAccessToken(token);

        assertThat(principal.userId()).isEqualTo(42L);
        assertThat(principal.role()).isEqualTo(UserRole.ADMIN);
        assertThat(principal.authority()).isEqualTo("ROLE_ADMIN");
    }

    @Test
    @DisplayName("TTL 경과 → EXPIRED")
    void expired() {
        String token = jwtService.issueAccessToken(1L, UserRole.CUSTOMER);
        clock.advance(Duration.ofSeconds(601));

        assertThatThrownBy(() -> jwtService.verifyAccessToken(token))
                .isInstanceOf(JwtService.InvalidJwtException.class)
                .satisfies(e -> assertThat(((JwtService.InvalidJwtException) e).reason())
                        .isEqualTo(JwtService.Reason.EXPIRED));
    }

    @Test
    @DisplayName("다른 키로 서명 / 다른 issuer / 쓰레기 값 → MALFORMED")
    void malformed_cases() {
        JwtService otherKey = new JwtService(props("weblarek", "another-secret-0123456789-abcdefghijkl"), clock);
        JwtService otherIssuer = new JwtService(props("someone-else", SECRET), clock);

        String foreignSigned = otherKey.issueAccessToken(1L, UserRole.CUSTOMER);
        String foreignIssuer = otherIssuer.issueAccessToken(1L, UserRole.CUSTOMER);

        for (String token : new String[] {foreignSigned, foreignIssuer, "garbage", "a.b.c", " "}) {
            assertThatThrownBy(() -> jwtService.verifyAccessToken(token))
                    .as("token=%s", token)
                    .isInstanceOf(JwtService.InvalidJwtException.class)
                    .satisfies(e -> assertThat(((JwtService.InvalidJwtException) e).reason())
                            .isEqualTo(JwtService.Reason.MALFORMED));
        }
    }

    @Test
    @DisplayName("secret이 32바이트 미만이면 생성 자체가 실패한다")
    void short_secret_is_rejected() {
        assertThatThrownBy(() -> new JwtService(props("weblarek", "too-short"), clock))
                .isInstanceOf(IllegalStateException.class);
    }

    private static AuthProperties props(String issuer, String secret) {
        return new AuthProperties(
                new AuthProperties.Jwt(issuer, 600, secret),
                new AuthProperties.Refresh("refreshToken", "/auth", AuthProperties.SameSite.Strict, false,
                        2592000, 604800, "unit-test-hash-secret-0123456789-abcdef", false)
        );
    }
}
