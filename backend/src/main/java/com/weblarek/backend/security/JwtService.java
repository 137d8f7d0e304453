package com.weblarek.backend.security;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

import javax.crypto.SecretKey;

import org.springframework.stereotype.Service;

import com.weblarek.backend.auth.config.AuthProperties;
import com.weblarek.backend.auth.domain.UserRole;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;

/**
 * Access JWT 발급/검증. HTTP는 모른다.
 *
 * 클레임: iss, sub(userId), role, jti, iat, exp
 * - 검증은 서명 + iss + exp 만 본다. DB 조회 없음.
 * - jti 덕분에 같은 초에 두 번 발급해도 문자열이 달라진다 (로테이션 직후 A2 != A1).
 * - 실패는 InvalidJwtException 하나로 나가고 reason이 EXPIRED / MALFORMED 를 가른다.
 */
@Service
public class JwtService {

    static final String ROLE_CLAIM = "role";
    private static final int HS256_MIN_KEY_BYTES = 32;

    private final String issuer;
    private final long accessTtlSeconds;
    private final Clock clock;
    private final SecretKey signingKey;
    private final JwtParser parser;

    public JwtService(AuthProperties props, Clock clock) {
        AuthProperties.Jwt jwt = props.jwt();
        if (jwt.issuer() == null || jwt.issuer().isBlank()) {
            throw new IllegalStateException("app.auth.jwt.issuer must not be blank");
        }

        this.issuer = jwt.issuer();
        this.accessTtlSeconds = jwt.accessTtlSeconds();
        this.clock = clock;
        this.signingKey = hs256Key(jwt.secret());
        this.parser = Jwts.parserBuilder()
                .requireIssuer(issuer)
                .setSigningKey(signingKey)
                .setClock(() -> Date.from(clock.instant())) // jjwt 0.11은 Date 기반
                .build();
    }

    public String issueAccessToken(Long userId, UserRole role) {
        if (userId == null || role == null) {
            throw new IllegalArgumentException("userId and role are required");
        }

        Instant issuedAt = clock.instant();
        return Jwts.builder()
                .setIssuer(issuer)
                .setSubject(userId.toString())
                .claim(ROLE_CLAIM, role.name())
                .setId(UUID.randomUUID().toString())
                .setIssuedAt(Date.from(issuedAt))
                .setExpiration(Date.from(issuedAt.plusSeconds(accessTtlSeconds)))
                .signWith(signingKey, SignatureAlgorithm.HS256)
                .compact();
    }

    public AuthPrincipal verifyAccessToken(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidJwtException(Reason.MALFORMED, "Empty JWT", null);
        }

        Claims claims;
        try {
            claims = parser.parseClaimsJws(token).getBody();
        } catch (ExpiredJwtException e) {
            throw new InvalidJwtException(Reason.EXPIRED, "Expired JWT", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidJwtException(Reason.MALFORMED, "Invalid JWT", e);
        }
        return toPrincipal(claims);
    }

    // 서명은 맞는데 우리 형식이 아닌 클레임도 MALFORMED
    private static AuthPrincipal toPrincipal(Claims claims) {
        try {
            String sub = claims.getSubject();
            String role = claims.get(ROLE_CLAIM, String.class);
            if (sub == null || role == null) {
                throw new InvalidJwtException(Reason.MALFORMED, "Missing sub or role claim", null);
            }
            return new AuthPrincipal(Long.valueOf(sub), UserRole.valueOf(role));
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidJwtException(Reason.MALFORMED, "Unexpected claims", e);
        }
    }

    private static SecretKey hs256Key(String secret) {
        byte[] bytes = (secret == null) ? new byte[0] : secret.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < HS256_MIN_KEY_BYTES) {
            throw new IllegalStateException(
                    "app.auth.jwt.secret must be at least " + HS256_MIN_KEY_BYTES + " bytes for HS256");
        }
        return Keys.hmacShaKeyFor(bytes);
    }

    public enum Reason { EXPIRED, MALFORMED }

    public static class InvalidJwtException extends RuntimeException {

        private final Reason reason;

        public InvalidJwtException(Reason reason, String message, Throwable cause) {
            super(message, cause);
            this.reason = reason;
        }

        public Reason reason() {
            return reason;
        }
    }
}
