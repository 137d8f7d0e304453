package com.weblarek.backend.auth.identity.login.service;

import java.time.Clock;
import java.time.LocalDateTime;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.weblarek.backend.auth.domain.User;
import com.weblarek.backend.auth.identity.support.EmailNormalizer;
import com.weblarek.backend.auth.repo.UserRepository;
import com.weblarek.backend.auth.token.service.TokenIssuer;
import com.weblarek.backend.auth.token.service.TokenIssuer.IssuedPair;
import com.weblarek.backend.auth.token.support.SessionClient;
import com.weblarek.backend.global.ApiException;
import com.weblarek.backend.global.ErrorCode;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 로그인 유스케이스
 *
 * 계약:
 * - "이메일 없음"과 "비밀번호 불일치"는 동일 에러(INVALID_CREDENTIALS)로 처리한다.
 * - ACTIVE 계정만 로그인 허용(그 외는 ACCOUNT_DISABLED).
 * - 성공 시 TokenIssuer가 access token(바디) + refresh token(raw, 쿠키용)을 발급한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoginService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final TokenIssuer tokenIssuer;
    private final Clock clock;

    @Transactional
    public LoginResult login(String rawEmail, String rawPassword, boolean rememberMe, SessionClient client) {
        if (isBlank(rawEmail) || isBlank(rawPassword)) {
            throw new ApiException(ErrorCode.INVALID_CREDENTIALS);
        }

        String email = EmailNormalizer.normalize(rawEmail);

        User user = userRepository.findByEmail(email)
                .orElseThrow(() -> new ApiException(ErrorCode.INVALID_CREDENTIALS));

        if (!passwordEncoder.matches(rawPassword, user.getPasswordHash())) {
            log.debug("로그인 실패(비밀번호 불일치): userId={}", user.getId());
            throw new ApiException(ErrorCode.INVALID_CREDENTIALS);
        }

        if (!user.isActive()) {
            throw new ApiException(ErrorCode.ACCOUNT_DISABLED);
        }

        // 영속 상태이므로 커밋 시점에 더티체킹으로 반영된다.
        user.setLastLoginAt(LocalDateTime.now(clock));

        IssuedPair pair = tokenIssuer.issuePair(user, rememberMe, client);
        return new LoginResult(user, pair);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    public record LoginResult(User user, IssuedPair pair) {}
}
