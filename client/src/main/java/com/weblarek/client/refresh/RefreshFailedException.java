package com.weblarek.client.refresh;

import lombok.Getter;

// refresh 엔드포인트가 2xx가 아니거나 accessToken 없이 응답했다
@Getter
public class RefreshFailedException extends RuntimeException {

    private final int status;

    public RefreshFailedException(int status, String message) {
        super(message);
        this.status = status;
    }

    public RefreshFailedException(String message, Throwable cause) {
        super(message, cause);
        this.status = -1;
    }
}
