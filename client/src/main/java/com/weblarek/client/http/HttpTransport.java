package com.weblarek.client.http;

import java.util.concurrent.CompletableFuture;

/**
 * 실제 네트워크 전송 계층.
 * 쿠키 저장소(jar)를 가지고 있어서 HttpOnly refresh 쿠키를 자동으로 주고받는다.
 */
public interface HttpTransport {

    /**
     * @param accessTokenOrNull null이 아니면 Authorization: Bearer 헤더로 붙인다
     * @return 응답이 오면 상태코드와 무관하게 정상 완료, I/O 오류면 TransportException으로 실패
     */
    CompletableFuture<ApiResponse> send(ApiRequest request, String accessTokenOrNull);

    // 강제 로그아웃 시 refresh 쿠키까지 지운다
    void clearCookies();
}
