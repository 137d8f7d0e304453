package com.weblarek.client.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

// login / register 응답 바디
@JsonIgnoreProperties(ignoreUnknown = true)
public record AuthSession(boolean success, AuthUser user, String accessToken) {
}
