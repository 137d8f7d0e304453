package com.weblarek.backend.auth.token.service;

import java.time.Clock;
import java.time.LocalDateTime;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.weblarek.backend.auth.config.AuthProperties;
import com.weblarek.backend.auth.domain.User;
import com.weblarek.backend.auth.token.domain.RefreshToken;
import com.weblarek.backend.auth.token.repo.RefreshTokenRepository;
import com.weblarek.backend.auth.token.support.RefreshTokenHasher;
import com.weblarek.backend.auth.token.support.SessionClient;
import com.weblarek.backend.auth.token.support.TokenGenerator;
import com.weblarek.backend.security.JwtService;

import lombok.RequiredArgsConstructor;

/**
 * 세션 발급기: access token(JWT) + refresh token(opaque) 한 쌍을 만든다.
 *
 * - login / register / rotate 세 경로가 모두 여기를 통한다.
 * - refresh 원문은 쿠키로만 내려가고, DB에는 HMAC 해시만 저장한다.
 *
 * rememberMe 정책
 * - rememberMe=true  → rememberMeSeconds
 * - rememberMe=false → sessionTtlSeconds
 */
@Service
@RequiredArgsConstructor
public class TokenIssuer {

    private final RefreshTokenRepository refreshTokenRepository;
    private final JwtService jwtService;
    private final TokenGenerator tokenGenerator;
    private final RefreshTokenHasher hasher;
    private final AuthProperties props;
    private final Clock clock;

    @Transactional
    public IssuedPair issuePair(User user, boolean rememberMe, SessionClient client) {
        if (user == null || user.getId() == null) {
            throw new IllegalArgumentException("user must be persisted before issuing tokens");
        }
        SessionClient c = (client == null) ? SessionClient.UNKNOWN : client;

        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime expiresAt = now.plusSeconds(resolveTtlSeconds(rememberMe));

        String raw = tokenGenerator.generateRefreshToken();
        String hash = hasher.hash(raw);

        refreshTokenRepository.save(
                RefreshToken.issue(user.getId(), hash, rememberMe, now, expiresAt, c.userAgent(), c.ipAddress())
        );

        String accessToken = jwtService.issueAccessToken(user.getId(), user.getRole());
        return new IssuedPair(accessToken, raw, expiresAt, rememberMe);
    }

    private long resolveTtlSeconds(boolean rememberMe) {
        return rememberMe
                ? props.refresh().rememberMeSeconds()
                : props.refresh().sessionTtlSeconds();
    }

    // refreshRaw는 쿠키로 내려줘야 하므로 원문 그대로 들고 나간다.
    public record IssuedPair(String accessToken, String refreshRaw, LocalDateTime refreshExpiresAt, boolean rememberMe) {}
}
