package com.weblarek.client.support;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.matchingJsonPath;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathMatching;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.ResponseDefinitionBuilder;
import com.github.tomakehurst.wiremock.stubbing.Scenario;
import com.github.tomakehurst.wiremock.stubbing.StubMapping;

/**
 * /auth/** 를 흉내 내는 WireMock 스텁 모음.
 *
 * 기본 응답(우선순위 낮음):
 * - POST /auth/login → 401 INVALID_CREDENTIALS
 * - GET /auth/token → 401 REFRESH_INVALID + 쿠키 삭제
 * - GET /auth/logout → 200 + 쿠키 삭제
 * - /auth/user, /api/** → 401 ACCESS_EXPIRED
 *
 * refresh 로테이션은 시나리오로 표현한다. R-1 → R-2 → ... 순서로 각 쿠키는 한 번만 통한다.
 */
public class AuthStubs implements AutoCloseable {

    public static final String EMAIL = "anna@weblarek.ru";
    public static final String PASSWORD = "larek-pass-1";

    private static final String COOKIE_NAME = "refreshToken";
    private static final String ROTATION = "refresh-rotation";
    private static final String CLEARED_COOKIE =
            COOKIE_NAME + "=; Path=/auth; Max-Age=0; Expires=Thu, 01 Jan 1970 00:00:00 GMT; HttpOnly; SameSite=Strict";
    private static final String USER_JSON =
            "{\"id\":1,\"email\":\"" + EMAIL + "\",\"name\":\"Anna\",\"roles\":[\"CUSTOMER\"]}";

    private static final int SPECIFIC = 1;
    private static final int FALLBACK = 10;

    private final WireMockServer server;
    private final Map<String, List<StubMapping>> accessStubs = new ConcurrentHashMap<>();

    public AuthStubs() {
        server = new WireMockServer(options().dynamicPort());
        server.start();
        stubFallbacks();
    }

    public WireMockServer server() {
        return server;
    }

    // 쿠키 도메인 매칭이 단순하도록 호스트명 대신 IP로 붙는다
    public URI baseUri() {
        return URI.create("http://127.0.0.1:" + server.port());
    }

    // 맞는 비밀번호면 A1 + R-1
    public AuthStubs loginIssuesFirstSession() {
        server.stubFor(post(urlEqualTo("/auth/login"))
                .atPriority(SPECIFIC)
                .withRequestBody(matchingJsonPath("$.password", equalTo(PASSWORD)))
                .willReturn(json(200, "{\"success\":true,\"user\":" + USER_JSON + ",\"accessToken\":\"A1\"}")
                        .withHeader("Set-Cookie", refreshCookie("R-1"))));
        return this;
    }

    /**
     * R-1 부터 {@code count} 번 로테이션을 허용한다. i번째 성공은 A(i+1), R-(i+1) 을 내준다.
     * 이미 쓴 쿠키를 다시 내면 시나리오 상태가 맞지 않아 기본 401로 떨어진다.
     */
    public AuthStubs rotations(int count, int delayMillis) {
        for (int i = 1; i <= count; i++) {
            String presented = "R-" + i;
            String next = "R-" + (i + 1);
            server.stubFor(get(urlEqualTo("/auth/token"))
                    .atPriority(SPECIFIC)
                    .withCookie(COOKIE_NAME, equalTo(presented))
                    .inScenario(ROTATION)
                    .whenScenarioStateIs(i == 1 ? Scenario.STARTED : presented + " live")
                    .willSetStateTo(next + " live")
                    .willReturn(json(200, "{\"accessToken\":\"A" + (i + 1) + "\"}")
                            .withHeader("Set-Cookie", refreshCookie(next))
                            .withFixedDelay(delayMillis)));
        }
        return this;
    }

    // 보호 경로에서 이 access token 을 받아 준다
    public AuthStubs acceptAccess(String token) {
        List<StubMapping> stubs = new ArrayList<>();
        stubs.add(server.stubFor(get(urlEqualTo("/auth/user"))
                .atPriority(SPECIFIC)
                .withHeader("Authorization", equalTo("Bearer " + token))
                .willReturn(json(200, "{\"user\":" + USER_JSON + ",\"success\":true}"))));
        stubs.add(server.stubFor(get(urlPathMatching("/api/.*"))
                .atPriority(SPECIFIC)
                .withHeader("Authorization", equalTo("Bearer " + token))
                .willReturn(json(200, "{\"ok\":true}"))));
        accessStubs.put(token, stubs);
        return this;
    }

    // 다음 보호 요청부터 이 토큰은 401
    public AuthStubs expireAccess(String token) {
        List<StubMapping> stubs = accessStubs.remove(token);
        if (stubs != null) {
            stubs.forEach(server::removeStub);
        }
        return this;
    }

    @Override
    public void close() {
        if (server.isRunning()) {
            server.stop();
        }
    }

    private void stubFallbacks() {
        server.stubFor(post(urlEqualTo("/auth/login"))
                .atPriority(FALLBACK)
                .willReturn(json(401, "{\"code\":\"INVALID_CREDENTIALS\",\"message\":\"Invalid email or password\"}")));
        server.stubFor(get(urlEqualTo("/auth/token"))
                .atPriority(FALLBACK)
                .willReturn(json(401, "{\"code\":\"REFRESH_INVALID\",\"message\":\"Refresh token invalid\"}")
                        .withHeader("Set-Cookie", CLEARED_COOKIE)));
        server.stubFor(get(urlEqualTo("/auth/logout"))
                .atPriority(FALLBACK)
                .willReturn(json(200, "{\"success\":true,\"message\":\"Logged out\"}")
                        .withHeader("Set-Cookie", CLEARED_COOKIE)));
        server.stubFor(get(urlPathMatching("/(auth/user|api/.*)"))
                .atPriority(FALLBACK)
                .willReturn(json(401, "{\"code\":\"ACCESS_EXPIRED\",\"message\":\"Access token expired\"}")));
    }

    private static String refreshCookie(String value) {
        return COOKIE_NAME + "=" + value + "; Path=/auth; HttpOnly; SameSite=Strict";
    }

    private static ResponseDefinitionBuilder json(int status, String body) {
        return aResponse()
                .withStatus(status)
                .withHeader("Content-Type", "application/json")
                .withHeader("Cache-Control", "no-store")
                .withBody(body);
    }
}
