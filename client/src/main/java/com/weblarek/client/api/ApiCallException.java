package com.weblarek.client.api;

import lombok.Getter;

/**
 * 타입 API 호출이 2xx가 아닌 응답을 받았다.
 * code/message는 백엔드 ApiError JSON({code, message})에서 꺼낸다. 파싱 못 하면 code는 null.
 */
@Getter
public class ApiCallException extends RuntimeException {

    private final int status;
    private final String code;

    public ApiCallException(int status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }
}
