package com.weblarek.backend.auth.token.service;

import java.time.Clock;
import java.time.LocalDateTime;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.weblarek.backend.auth.config.AuthProperties;
import com.weblarek.backend.auth.domain.User;
import com.weblarek.backend.auth.repo.UserRepository;
import com.weblarek.backend.auth.token.domain.RefreshRevokeReason;
import com.weblarek.backend.auth.token.domain.RefreshToken;
import com.weblarek.backend.auth.token.repo.RefreshTokenRepository;
import com.weblarek.backend.auth.token.service.TokenIssuer.IssuedPair;
import com.weblarek.backend.auth.token.support.RefreshTokenHasher;
import com.weblarek.backend.auth.token.support.SessionClient;
import com.weblarek.backend.auth.token.support.TokenGenerator;
import com.weblarek.backend.global.ApiException;
import com.weblarek.backend.global.ErrorCode;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Refresh Token 로테이션/폐기 서비스
 *
 * 상태 머신 (row 하나 기준):
 *   ACTIVE --rotate--> CONSUMED (revoke_reason=ROTATED)
 *   ACTIVE --logout/admin/reuse--> REVOKED
 *   ACTIVE --시간 경과--> EXPIRED
 * CONSUMED/REVOKED/EXPIRED 에서 나가는 전이는 없다.
 *
 * 동시성:
 * - 조회 후 바로 바꾸지 않고 consumeIfActive(조건부 UPDATE)의 영향 row 수로 승자를 가린다.
 * - 같은 토큰으로 동시에 두 번 와도 성공은 최대 한 번이다.
 *
 * 실패 시 트랜잭션은 롤백하지 않는다(noRollbackFor): 재사용 감지 시 전체 폐기는 남아야 한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RefreshTokenService {

    private final RefreshTokenRepository refreshTokenRepository;
    private final UserRepository userRepository;
    private final TokenIssuer tokenIssuer;
    private final RefreshTokenHasher hasher;
    private final AuthProperties props;
    private final Clock clock;

    // 리프레시 토큰 로테이션
    @Transactional(noRollbackFor = ApiException.class)
    public RotateResult rotate(String oldRefreshRaw, SessionClient client) {
        if (oldRefreshRaw == null || oldRefreshRaw.isBlank() || !TokenGenerator.isWellFormed(oldRefreshRaw)) {
            throw new ApiException(ErrorCode.REFRESH_INVALID);
        }

        LocalDateTime now = LocalDateTime.now(clock);

        RefreshToken old = refreshTokenRepository.findByTokenHash(hasher.hash(oldRefreshRaw))
                .orElseThrow(() -> new ApiException(ErrorCode.REFRESH_INVALID));

        switch (old.stateAt(now)) {
            case CONSUMED -> throw reuseDetected(old, "이미 로테이션된 refresh 재제출");
            case REVOKED -> throw new ApiException(ErrorCode.REFRESH_REVOKED);
            case EXPIRED -> throw new ApiException(ErrorCode.REFRESH_EXPIRED);
            case ACTIVE -> { }
        }

        // 유저 없음은 REFRESH_INVALID로 뭉갠다 (정보 노출 방지)
        User user = userRepository.findById(old.getUserId())
                .orElseThrow(() -> new ApiException(ErrorCode.REFRESH_INVALID));

        if (!user.isActive()) {
            throw new ApiException(ErrorCode.REFRESH_REVOKED);
        }

        // 원자적 소비. 0이면 동시 요청에게 졌다. 재사용과 같은 정책을 탄다.
        if (refreshTokenRepository.consumeIfActive(old.getId(), now) == 0) {
            throw reuseDetected(old, "refresh 동시 소비 경합에서 패배");
        }

        IssuedPair pair = tokenIssuer.issuePair(user, old.isRememberMe(), client);
        log.debug("refresh 로테이션 완료: userId={}, oldTokenId={}", user.getId(), old.getId());
        return new RotateResult(user, pair);
    }

    // 재사용 감지 공통 처리. 정책이 켜져 있으면 그 사용자의 활성 세션을 모두 닫는다.
    private ApiException reuseDetected(RefreshToken old, String situation) {
        log.warn("{}: tokenId={}, userId={}", situation, old.getId(), old.getUserId());
        if (props.refresh().revokeAllOnReuse()) {
            revokeAll(old.getUserId(), RefreshRevokeReason.REUSE_DETECTED);
        }
        return new ApiException(ErrorCode.REFRESH_REUSED);
    }

    /**
     * 로그아웃용 단건 폐기 (멱등)
     * - 쿠키 없음 / 형식 불량 / 미발급 / 이미 폐기 → 아무 일도 안 한다.
     */
    @Transactional
    public void revoke(String refreshRaw) {
        if (refreshRaw == null || refreshRaw.isBlank() || !TokenGenerator.isWellFormed(refreshRaw)) {
            return;
        }
        int revoked = refreshTokenRepository.revokeIfActive(
                hasher.hash(refreshRaw), RefreshRevokeReason.LOGOUT, LocalDateTime.now(clock));
        log.debug("logout revoke: affected={}", revoked);
    }

    // 사용자 전체 세션 폐기 (관리자 강제 종료 / 재사용 감지)
    @Transactional
    public int revokeAll(Long userId, RefreshRevokeReason reason) {
        if (userId == null) throw new IllegalArgumentException("userId must not be null");
        if (reason == null) throw new IllegalArgumentException("reason must not be null");

        int revoked = refreshTokenRepository.revokeAllActiveByUserId(userId, reason, LocalDateTime.now(clock));
        log.info("사용자 세션 전체 폐기: userId={}, reason={}, revoked={}", userId, reason, revoked);
        return revoked;
    }

    public record RotateResult(User user, IssuedPair pair) {}
}
