package com.weblarek.backend.auth.identity.register.service;

import java.time.Clock;
import java.time.LocalDateTime;

import org.springframework.dao.DataIntegrityViolationException;
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
 * 회원가입 유스케이스
 *
 * - 가입 즉시 로그인 상태가 된다 (rememberMe=false 세션 발급).
 * - 중복 이메일은 exists 선검사 + uq_users_email 제약 두 겹으로 막는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RegisterService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final TokenIssuer tokenIssuer;
    private final Clock clock;

    @Transactional
    public RegisterResult register(String rawEmail, String rawPassword, String rawName, SessionClient client) {
        String email = EmailNormalizer.normalize(rawEmail);
        String name = rawName == null ? null : rawName.trim();

        if (userRepository.existsByEmail(email)) {
            throw new ApiException(ErrorCode.EMAIL_ALREADY_EXISTS);
        }

        User user;
        try {
            // 동시 가입 경쟁은 DB unique 제약이 최종 판정한다.
            user = userRepository.saveAndFlush(
                    User.create(email, passwordEncoder.encode(rawPassword), name, LocalDateTime.now(clock))
            );
        } catch (DataIntegrityViolationException e) {
            throw new ApiException(ErrorCode.EMAIL_ALREADY_EXISTS);
        }

        log.info("회원가입 완료: userId={}", user.getId());

        IssuedPair pair = tokenIssuer.issuePair(user, false, client);
        return new RegisterResult(user, pair);
    }

    public record RegisterResult(User user, IssuedPair pair) {}
}
