package com.weblarek.backend.auth.refresh;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import com.weblarek.backend.auth.AbstractAuthIntegrationTest;
import com.weblarek.backend.auth.domain.User;
import com.weblarek.backend.auth.support.AuthFlowSupport;
import com.weblarek.backend.auth.support.AuthHttpSupport;
import com.weblarek.backend.auth.support.AuthHttpSupport.SessionResult;
import com.weblarek.backend.auth.token.domain.RefreshRevokeReason;
import com.weblarek.backend.auth.token.service.RefreshTokenService;
import com.weblarek.backend.auth.token.service.RefreshTokenService.RotateResult;
import com.weblarek.backend.auth.token.support.SessionClient;
import com.weblarek.backend.global.ApiException;
import com.weblarek.backend.global.ErrorCode;

@TestPropertySource(properties = "app.auth.refresh.revoke-all-on-reuse=true")
@DisplayName("[Auth][Refresh] revoke-all-on-reuse=true 정책 통합 테스트")
class AuthRefreshReusePolicyTest extends AbstractAuthIntegrationTest {

    @Autowired MockMvc mvc;
    @Autowired RefreshTokenService refreshTokenService;

    private User user;

    @BeforeEach
    void setUp() {
        user = createDefaultUser();
    }

    @Test
    @DisplayName("구 refresh 재사용 → REFRESH_REUSED + 그 사용자의 모든 활성 세션이 REUSE_DETECTED로 폐기")
    void reuse_revokes_every_session_of_user() throws Exception {
        SessionResult deviceA = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD, false);
        SessionResult deviceB = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD, true);
        SessionResult rotatedA = AuthFlowSupport.refreshOk(mvc, deviceA.refreshRaw());

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performToken(mvc, deviceA.refreshRaw()),
                ErrorCode.REFRESH_REUSED);

        // 실패 응답이어도 폐기는 커밋되어 있어야 한다
        Integer active = jdbc.queryForObject(
                "select count(*) from refresh_tokens where user_id = ? and revoked_at is null",
                Integer.class, user.getId());
        Integer reuseRevoked = jdbc.queryForObject(
                "select count(*) from refresh_tokens where user_id = ? and revoke_reason = ?",
                Integer.class, user.getId(), RefreshRevokeReason.REUSE_DETECTED.name());

        assertThat(active).isZero();
        assertThat(reuseRevoked).isEqualTo(2);

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performToken(mvc, rotatedA.refreshRaw()),
                ErrorCode.REFRESH_REVOKED);
        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performToken(mvc, deviceB.refreshRaw()),
                ErrorCode.REFRESH_REVOKED);
    }

    @RepeatedTest(5)
    @DisplayName("같은 refresh로 동시 rotate 2번 → 패자도 REFRESH_REUSED + 승자 세션까지 전부 폐기")
    void concurrent_rotate_loser_applies_reuse_policy() throws Exception {
        String raw = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD, false).refreshRaw();

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            CountDownLatch ready = new CountDownLatch(2);
            CountDownLatch go = new CountDownLatch(1);

            Callable<RotateResult> task = () -> {
                ready.countDown();
                go.await();
                return refreshTokenService.rotate(raw, SessionClient.UNKNOWN);
            };

            List<Future<RotateResult>> futures = new ArrayList<>();
            futures.add(pool.submit(task));
            futures.add(pool.submit(task));

            assertThat(ready.await(5, TimeUnit.SECONDS)).isTrue();
            go.countDown();

            RotateResult winner = null;
            Throwable loser = null;
            for (Future<RotateResult> f : futures) {
                try {
                    winner = f.get(20, TimeUnit.SECONDS);
                } catch (ExecutionException e) {
                    loser = e.getCause();
                }
            }

            assertThat(winner).isNotNull();
            assertThat(loser).isInstanceOf(ApiException.class);
            assertThat(((ApiException) loser).getErrorCode()).isEqualTo(ErrorCode.REFRESH_REUSED);

            // 패자는 승자의 커밋 이후에 끝나므로 승자가 새로 받은 세션도 닫혀 있어야 한다
            Integer active = jdbc.queryForObject(
                    "select count(*) from refresh_tokens where user_id = ? and revoked_at is null",
                    Integer.class, user.getId());
            Integer reuseRevoked = jdbc.queryForObject(
                    "select count(*) from refresh_tokens where user_id = ? and revoke_reason = ?",
                    Integer.class, user.getId(), RefreshRevokeReason.REUSE_DETECTED.name());

            assertThat(active).isZero();
            assertThat(reuseRevoked).isGreaterThanOrEqualTo(1);

            AuthHttpSupport.expectErrorWithCode(
                    AuthHttpSupport.performToken(mvc, winner.pair().refreshRaw()),
                    ErrorCode.REFRESH_REVOKED);
        } finally {
            pool.shutdownNow();
        }
    }
}
