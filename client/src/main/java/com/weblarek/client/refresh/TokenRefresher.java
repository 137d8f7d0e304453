package com.weblarek.client.refresh;

import java.util.concurrent.CompletableFuture;

/**
 * 새 access token을 받아온다. 성공하면 토큰 문자열로 완료, 실패하면 예외로 완료.
 * 게이트웨이는 동시에 하나의 refresh()만 호출한다.
 */
@FunctionalInterface
public interface TokenRefresher {

    CompletableFuture<String> refresh();
}
