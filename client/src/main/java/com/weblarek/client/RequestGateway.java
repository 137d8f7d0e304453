package com.weblarek.client;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.locks.ReentrantLock;

import com.weblarek.client.http.ApiRequest;
import com.weblarek.client.http.ApiResponse;
import com.weblarek.client.http.HttpTransport;
import com.weblarek.client.refresh.TokenRefresher;

import lombok.extern.slf4j.Slf4j;

/**
 * 모든 API 호출이 지나는 게이트웨이.
 *
 * 흐름:
 * 1) 현재 access token을 붙여 전송
 * 2) 401이면(로그인/가입/refresh 경로 제외) refresh 프로토콜로 들어간다
 *    - 보낸 뒤에 이미 토큰이 바뀌었으면 (다른 호출이 refresh 끝냄) 바로 재전송
 *    - 토큰을 들고 보냈는데 세션이 비었으면 (그 사이 로그아웃) refresh 없이 SessionExpiredException
 *    - refresh 진행 중이면 대기열에 넣고, 끝나면 재전송
 *    - 아니면 직접 refresh 시작
 * 3) refresh 성공: 토큰 저장 → 대기열 비우고 플래그 해제 → 대기자 전부 깨움 → 자기 요청 재전송
 *    refresh 실패: 대기열 비우고 플래그 해제 → 강제 로그아웃 → 대기자와 자신 모두 SessionExpiredException
 * 4) 재전송은 일반 send 한 번이다. 재전송이 또 401이어도 두 번째 refresh는 없다.
 *
 * 불변 조건:
 * - 동시에 진행 중인 refresh()는 최대 1개
 * - 401을 본 호출자는 정확히 한 번 완료(성공 또는 실패)된다
 * - refreshInProgress / pending 은 lock 안에서만 읽고 쓴다. future 완료는 lock 밖에서 한다.
 */
@Slf4j
public class RequestGateway {

    private final HttpTransport transport;
    private final TokenRefresher refresher;
    private final SessionStore sessionStore;
    private final ClientConfig config;
    private final ForcedLogoutListener logoutListener;

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<CompletableFuture<Void>> pending = new ArrayDeque<>(); // guarded by lock
    private boolean refreshInProgress;                                          // guarded by lock

    public RequestGateway(HttpTransport transport,
                          TokenRefresher refresher,
                          SessionStore sessionStore,
                          ClientConfig config,
                          ForcedLogoutListener logoutListener) {
        this.transport = transport;
        this.refresher = refresher;
        this.sessionStore = sessionStore;
        this.config = config;
        this.logoutListener = (logoutListener == null) ? ForcedLogoutListener.NO_OP : logoutListener;
    }

    public CompletableFuture<ApiResponse> execute(ApiRequest request) {
        String sentWith = sessionStore.get();

        return send(request, sentWith).thenCompose(response -> {
            if (!response.isUnauthorized() || !config.isRefreshable(request.path())) {
                return CompletableFuture.completedFuture(response);
            }
            return awaitFreshToken(sentWith)
                    .thenCompose(ignored -> send(request, sessionStore.get()));
        });
    }

    // 테스트/진단용
    public boolean isRefreshInProgress() {
        lock.lock();
        try {
            return refreshInProgress;
        } finally {
            lock.unlock();
        }
    }

    public int pendingCount() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    private CompletableFuture<Void> awaitFreshToken(String sentWith) {
        lock.lock();
        try {
            String current = sessionStore.get();
            if (current != null && !current.equals(sentWith)) {
                return CompletableFuture.completedFuture(null);
            }

            // 토큰을 들고 나갔는데 돌아와 보니 세션이 비어 있다: 그 사이 로그아웃됐다.
            if (current == null && sentWith != null) {
                log.debug("응답 대기 중 세션 종료됨, refresh 없이 거절");
                return CompletableFuture.failedFuture(new SessionExpiredException());
            }

            if (refreshInProgress) {
                CompletableFuture<Void> entry = new CompletableFuture<>();
                pending.addLast(entry);
                return entry;
            }

            refreshInProgress = true;
        } finally {
            lock.unlock();
        }

        return runRefresh();
    }

    private CompletableFuture<Void> runRefresh() {
        log.debug("access token refresh 시작");

        CompletableFuture<String> refreshed;
        try {
            refreshed = refresher.refresh();
            if (refreshed == null) {
                refreshed = CompletableFuture.failedFuture(new IllegalStateException("refresher returned null"));
            }
        } catch (RuntimeException e) {
            refreshed = CompletableFuture.failedFuture(e);
        }

        CompletableFuture<Void> outcome = new CompletableFuture<>();
        refreshed.whenComplete((token, error) -> {
            Throwable failure = unwrap(error);
            if (failure == null && (token == null || token.isBlank())) {
                failure = new IllegalStateException("refresh completed without a token");
            }

            if (failure == null) {
                sessionStore.set(token);
                List<CompletableFuture<Void>> waiters = drain();
                log.debug("access token refresh 성공: 대기 요청 {}건 재전송", waiters.size());
                waiters.forEach(w -> w.complete(null));
                outcome.complete(null);
                return;
            }

            List<CompletableFuture<Void>> waiters = drain();
            forceLogout(failure);
            SessionExpiredException expired = new SessionExpiredException(failure);
            waiters.forEach(w -> w.completeExceptionally(expired));
            outcome.completeExceptionally(expired);
        });
        return outcome;
    }

    // 대기열을 꺼내고 플래그를 내린다. 꺼낸 future들은 호출자가 lock 밖에서 완료한다.
    private List<CompletableFuture<Void>> drain() {
        lock.lock();
        try {
            List<CompletableFuture<Void>> waiters = new ArrayList<>(pending);
            pending.clear();
            refreshInProgress = false;
            return waiters;
        } finally {
            lock.unlock();
        }
    }

    private void forceLogout(Throwable cause) {
        log.info("refresh 실패로 강제 로그아웃: {}", cause.toString());

        sessionStore.clear();
        try {
            transport.clearCookies();
        } catch (RuntimeException e) {
            log.warn("쿠키 저장소 정리 실패", e);
        }
        try {
            logoutListener.onForcedLogout(cause);
        } catch (RuntimeException e) {
            log.warn("ForcedLogoutListener 예외", e);
        }
    }

    private CompletableFuture<ApiResponse> send(ApiRequest request, String accessToken) {
        try {
            CompletableFuture<ApiResponse> future = transport.send(request, accessToken);
            return (future != null)
                    ? future
                    : CompletableFuture.failedFuture(new IllegalStateException("transport returned null"));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
