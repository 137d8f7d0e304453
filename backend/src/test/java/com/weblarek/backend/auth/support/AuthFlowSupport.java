package com.weblarek.backend.auth.support;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;

import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;

import com.fasterxml.jackson.databind.JsonNode;
import com.weblarek.backend.auth.support.AuthHttpSupport.SessionResult;

// AuthFlowSupport = "성공 플로우"를 짧게 만드는 고수준(HIGH-LEVEL) 유틸 (테스트 전용)
public final class AuthFlowSupport {
    private AuthFlowSupport() {}

    // POST /auth/login 200 + accessToken(body) + refresh(Set-Cookie)
    public static SessionResult loginOk(MockMvc mvc, String email, String password, boolean rememberMe) throws Exception {
        return expectSession(AuthHttpSupport.performLogin(mvc, email, password, rememberMe), 200, "login");
    }

    // POST /auth/register 201
    public static SessionResult registerOk(MockMvc mvc, String email, String password, String name) throws Exception {
        return expectSession(AuthHttpSupport.performRegister(mvc, email, password, name), 201, "register");
    }

    // GET /auth/token 200 + 로테이션된 새 refresh
    public static SessionResult refreshOk(MockMvc mvc, String refreshRaw) throws Exception {
        assertThat(refreshRaw)
                .as("refreshOk 호출 시 refreshRaw는 비어있으면 안 됨")
                .isNotBlank();

        return expectSession(AuthHttpSupport.performToken(mvc, refreshRaw), 200, "token");
    }

    private static SessionResult expectSession(ResultActions actions, int expectedStatus, String flowName) throws Exception {
        MvcResult res = actions
                .andExpect(status().is(expectedStatus))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andReturn();

        JsonNode body = AuthHttpSupport.readJson(res);
        assertThat(body.path("success").asBoolean())
                .as("[%s] success=true 여야 함", flowName)
                .isTrue();

        String accessToken = body.path("accessToken").asText(null);
        assertThat(accessToken)
                .as("[%s] 응답 JSON에 accessToken이 있어야 함", flowName)
                .isNotBlank();

        List<String> setCookieHeaders = AuthHttpSupport.setCookieHeaders(res);
        assertThat(setCookieHeaders)
                .as("[%s] Set-Cookie 헤더가 최소 1개 이상 있어야 함", flowName)
                .isNotNull()
                .isNotEmpty();

        String refreshRaw = AuthHttpSupport.extractCookieValue(setCookieHeaders, AuthHttpSupport.REFRESH_COOKIE);
        assertThat(refreshRaw)
                .as("[%s] Set-Cookie에서 refresh 값을 추출해야 함. headers=%s", flowName, setCookieHeaders)
                .isNotBlank();

        return new SessionResult(accessToken, refreshRaw, body, setCookieHeaders);
    }
}
