package com.weblarek.backend.global;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드(클라이언트 분기용) + HTTP 상태 + 기본 메시지의 단일 소스.
 *
 * 원칙:
 * - code = enum name() (변경 시 API 계약 깨짐)
 * - 401 계열 중 ACCESS_* 는 클라이언트가 refresh를 시도하는 신호,
 *   REFRESH_* 는 강제 로그아웃 신호다.
 */
public enum ErrorCode {

    // Register / Profile
    EMAIL_ALREADY_EXISTS(HttpStatus.CONFLICT,
            "이미 가입된 이메일입니다."),

    // Login
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED,
            "이메일 또는 비밀번호가 올바르지 않습니다."),
    ACCOUNT_DISABLED(HttpStatus.FORBIDDEN,
            "사용할 수 없는 계정 상태입니다."),

    // Auth / Security
    AUTH_REQUIRED(HttpStatus.UNAUTHORIZED,
            "인증이 필요합니다."),
    ACCESS_INVALID(HttpStatus.UNAUTHORIZED,
            "엑세스 토큰이 유효하지 않습니다."),
    ACCESS_EXPIRED(HttpStatus.UNAUTHORIZED,
            "엑세스 토큰이 만료되었습니다."),
    FORBIDDEN(HttpStatus.FORBIDDEN,
            "접근 권한이 없습니다."),

    // Refresh token
    REFRESH_INVALID(HttpStatus.UNAUTHORIZED,
            "세션이 유효하지 않습니다. 다시 로그인해주세요."),
    REFRESH_EXPIRED(HttpStatus.UNAUTHORIZED,
            "세션이 만료되었습니다. 다시 로그인해주세요."),
    REFRESH_REUSED(HttpStatus.UNAUTHORIZED,
            "세션이 유효하지 않습니다. 다시 로그인해주세요."), // 보안상 메시지 뭉개기
    REFRESH_REVOKED(HttpStatus.UNAUTHORIZED,
            "세션이 유효하지 않습니다. 다시 로그인해주세요."), // 보안상 메시지 뭉개기

    // User
    USER_NOT_FOUND(HttpStatus.NOT_FOUND,
            "사용자를 찾을 수 없습니다."),

    // Validation / Common
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST,
            "요청 값이 올바르지 않습니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND,
            "존재하지 않는 경로입니다."),
    METHOD_NOT_ALLOWED(HttpStatus.METHOD_NOT_ALLOWED,
            "지원하지 않는 HTTP 메서드입니다."),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR,
            "서버 오류가 발생했습니다.");

    private final HttpStatus status;
    private final String defaultMessage;

    ErrorCode(HttpStatus status, String defaultMessage) {
        this.status = status;
        this.defaultMessage = defaultMessage;
    }

    public HttpStatus status() {
        return status;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
