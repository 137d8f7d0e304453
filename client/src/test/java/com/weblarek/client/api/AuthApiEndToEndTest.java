package com.weblarek.client.api;

import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.exactly;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.weblarek.client.ClientConfig;
import com.weblarek.client.RequestGateway;
import com.weblarek.client.SessionExpiredException;
import com.weblarek.client.SessionStore;
import com.weblarek.client.api.dto.AuthSession;
import com.weblarek.client.api.dto.AuthUser;
import com.weblarek.client.http.ApiRequest;
import com.weblarek.client.http.ApiResponse;
import com.weblarek.client.http.JdkHttpTransport;
import com.weblarek.client.refresh.CookieTokenRefresher;
import com.weblarek.client.support.AuthStubs;

@DisplayName("[Client] AuthApi + RequestGateway (WireMock)")
class AuthApiEndToEndTest {

    private static final String EMAIL = AuthStubs.EMAIL;
    private static final String PASSWORD = AuthStubs.PASSWORD;

    private AuthStubs stubs;
    private SessionStore store;
    private JdkHttpTransport transport;
    private RequestGateway gateway;
    private AuthApi api;
    private AtomicInteger forcedLogouts;

    @BeforeEach
    void setUp() {
        stubs = new AuthStubs().loginIssuesFirstSession();
        ClientConfig config = ClientConfig.defaults(stubs.baseUri());
        ObjectMapper objectMapper = new ObjectMapper();

        store = new SessionStore();
        transport = new JdkHttpTransport(config);
        forcedLogouts = new AtomicInteger();
        gateway = new RequestGateway(transport, new CookieTokenRefresher(transport, config, objectMapper),
                store, config, cause -> forcedLogouts.incrementAndGet());
        api = new AuthApi(gateway, store, transport, objectMapper);
    }

    @AfterEach
    void tearDown() {
        stubs.close();
    }

    private int tokenHits() {
        return stubs.server().findAll(getRequestedFor(urlEqualTo("/auth/token"))).size();
    }

    @Test
    @DisplayName("login 성공 → access 저장, 응답에 user/accessToken")
    void login_stores_access_token() {
        stubs.acceptAccess("A1");
        AuthSession session = api.login(EMAIL, PASSWORD, true).join();

        assertThat(session.success()).isTrue();
        assertThat(session.user().email()).isEqualTo(EMAIL);
        assertThat(session.accessToken()).isEqualTo("A1");
        assertThat(store.get()).isEqualTo("A1");

        AuthUser me = api.currentUser().join();
        assertThat(me.roles()).containsExactly("CUSTOMER");
    }

    @Test
    @DisplayName("login 실패 → ApiCallException(401, INVALID_CREDENTIALS), refresh 시도 없음")
    void login_failure_is_api_call_exception() {
        Throwable thrown = catchThrowable(() -> api.login(EMAIL, "wrong-password", false).join());

        assertThat(thrown).isInstanceOf(CompletionException.class).hasCauseInstanceOf(ApiCallException.class);
        ApiCallException e = (ApiCallException) thrown.getCause();
        assertThat(e.getStatus()).isEqualTo(401);
        assertThat(e.getCode()).isEqualTo("INVALID_CREDENTIALS");
        assertThat(e.getMessage()).isEqualTo("Invalid email or password");

        stubs.server().verify(0, getRequestedFor(urlEqualTo("/auth/token")));
        assertThat(store.get()).isNull();
    }

    @Test
    @DisplayName("access 만료 중 동시 호출 5건 → /auth/token 은 정확히 1번, 전부 성공")
    void concurrent_calls_share_single_refresh() throws Exception {
        // 로그인 직후의 A1은 이미 만료된 것으로 취급된다
        stubs.acceptAccess("A2").rotations(1, 200);
        api.login(EMAIL, PASSWORD, true).join();

        List<CompletableFuture<ApiResponse>> calls = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            calls.add(gateway.execute(ApiRequest.get("/api/orders/" + i)));
        }

        for (CompletableFuture<ApiResponse> call : calls) {
            assertThat(call.get(10, TimeUnit.SECONDS).status()).isEqualTo(200);
        }
        stubs.server().verify(exactly(1), getRequestedFor(urlEqualTo("/auth/token")));
        assertThat(store.get()).isEqualTo("A2");
        assertThat(forcedLogouts.get()).isZero();
    }

    @Test
    @DisplayName("로테이션된 쿠키로 다음 만료도 복구된다")
    void rotated_cookie_survives_next_expiry() {
        stubs.acceptAccess("A2").rotations(2, 0);
        api.login(EMAIL, PASSWORD, true).join();

        assertThat(api.currentUser().join().id()).isEqualTo(1L);
        stubs.expireAccess("A2").acceptAccess("A3");
        assertThat(api.currentUser().join().id()).isEqualTo(1L);

        assertThat(tokenHits()).isEqualTo(2);
        stubs.server().verify(getRequestedFor(urlEqualTo("/auth/token"))
                .withCookie("refreshToken", equalTo("R-2")));
        assertThat(store.get()).isEqualTo("A3");
    }

    @Test
    @DisplayName("logout → 로컬 세션/쿠키 정리, 이후 보호 호출은 SessionExpiredException + 강제 로그아웃 1회")
    void logout_then_protected_call_expires_session() {
        stubs.rotations(1, 0);
        api.login(EMAIL, PASSWORD, true).join();

        api.logout().join();
        assertThat(store.isAuthenticated()).isFalse();

        assertThatThrownBy(() -> api.currentUser().join())
                .hasCauseInstanceOf(SessionExpiredException.class);
        stubs.server().verify(exactly(1), getRequestedFor(urlEqualTo("/auth/token")));
        stubs.server().verify(getRequestedFor(urlEqualTo("/auth/token")).withoutHeader("Cookie"));
        assertThat(forcedLogouts.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("서버가 죽어 있어도 logout 은 로컬 상태를 비우고 정상 완료")
    void logout_without_server_still_clears_local_state() {
        api.login(EMAIL, PASSWORD, true).join();
        stubs.close();

        api.logout().join();

        assertThat(store.get()).isNull();
    }
}
