package com.weblarek.client.http;

// 연결 실패 / 타임아웃 같은 I/O 오류. HTTP 응답이 온 경우(4xx/5xx)는 여기 해당하지 않는다.
public class TransportException extends RuntimeException {

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
