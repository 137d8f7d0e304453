package com.weblarek.backend.auth.admin.dto;

public record SessionRevokeResponse(boolean success, int revoked) {
}
