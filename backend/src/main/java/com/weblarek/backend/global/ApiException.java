package com.weblarek.backend.global;

import java.util.Objects;

import org.springframework.http.HttpStatus;

/**
 * 도메인 규칙 위반. 상태 코드와 code 문자열은 전부 ErrorCode에서 나온다.
 *
 * <pre>
 * throw new ApiException(ErrorCode.REFRESH_REUSED);
 * </pre>
 */
public class ApiException extends RuntimeException {

    private final ErrorCode errorCode;

    public ApiException(ErrorCode errorCode) {
        super(Objects.requireNonNull(errorCode, "errorCode").defaultMessage());
        this.errorCode = errorCode;
    }

    // 로그에만 남길 상세 사유가 있을 때. 응답 message는 기본 문구 그대로다.
    public ApiException(ErrorCode errorCode, Throwable cause) {
        super(Objects.requireNonNull(errorCode, "errorCode").defaultMessage(), cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public HttpStatus getStatus() {
        return errorCode.status();
    }
}
