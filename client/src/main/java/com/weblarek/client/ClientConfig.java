package com.weblarek.client;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;

/**
 * 클라이언트 설정
 *
 * - baseUri: 백엔드 주소 (예: http://localhost:8080)
 * - requestTimeout: 요청 하나의 타임아웃. 대기 큐에는 별도 타임아웃이 없으므로 이 값이 상한이다.
 * - refreshPath: 쿠키로 access를 재발급받는 경로
 * - nonRefreshablePaths: 401이 와도 refresh를 시도하지 않는 경로 (자격 증명 오류 / refresh 자체)
 */
public record ClientConfig(
        URI baseUri,
        Duration requestTimeout,
        String refreshPath,
        Set<String> nonRefreshablePaths
) {

    public static final String LOGIN_PATH = "/auth/login";
    public static final String REGISTER_PATH = "/auth/register";
    public static final String TOKEN_PATH = "/auth/token";

    public ClientConfig {
        Objects.requireNonNull(baseUri, "baseUri must not be null");
        Objects.requireNonNull(requestTimeout, "requestTimeout must not be null");
        if (refreshPath == null || !refreshPath.startsWith("/")) {
            throw new IllegalArgumentException("refreshPath must start with '/'");
        }
        nonRefreshablePaths = Set.copyOf(Objects.requireNonNull(nonRefreshablePaths, "nonRefreshablePaths must not be null"));
    }

    public static ClientConfig defaults(URI baseUri) {
        return new ClientConfig(
                baseUri,
                Duration.ofSeconds(10),
                TOKEN_PATH,
                Set.of(LOGIN_PATH, REGISTER_PATH, TOKEN_PATH)
        );
    }

    // 쿼리스트링은 떼고 비교한다
    public boolean isRefreshable(String path) {
        if (path == null) return false;
        int q = path.indexOf('?');
        String bare = q < 0 ? path : path.substring(0, q);
        return !nonRefreshablePaths.contains(bare);
    }
}
