package com.weblarek.backend.global;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 모든 에러 응답의 JSON 모양: {code, message, violations?}
 *
 * 컨트롤러 예외든 시큐리티 필터(401/403)든 이 record 하나로 나간다.
 * violations는 입력 검증 실패일 때만 채운다.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ApiError(
        String code,    // ErrorCode.name(), 클라이언트 분기 키
        String message,
        List<Violation> violations
) {

    // 검증 실패 항목 하나. field는 "email", "password" 같은 요청 필드명
    public record Violation(String field, String reason) {}

    public static ApiError of(ErrorCode errorCode) {
        return new ApiError(errorCode.name(), errorCode.defaultMessage(), List.of());
    }

    public static ApiError invalid(List<Violation> violations) {
        ErrorCode c = ErrorCode.VALIDATION_ERROR;
        return new ApiError(c.name(), c.defaultMessage(), List.copyOf(violations));
    }

    public static ApiError from(ApiException e) {
        return new ApiError(e.getErrorCode().name(), e.getMessage(), List.of());
    }
}
