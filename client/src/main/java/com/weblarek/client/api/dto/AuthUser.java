package com.weblarek.client.api.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AuthUser(Long id, String email, String name, List<String> roles) {
}
