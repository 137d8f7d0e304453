package com.weblarek.backend.auth.token.dto;

public record LogoutResponse(boolean success, String message) {

    public static LogoutResponse ok() {
        return new LogoutResponse(true, "Выход выполнен");
    }
}
