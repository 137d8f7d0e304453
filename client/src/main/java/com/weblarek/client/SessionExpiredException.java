package com.weblarek.client;

/**
 * refresh가 실패해서 강제 로그아웃된 뒤, 401을 받았던 모든 호출자에게 전달되는 예외.
 */
public class SessionExpiredException extends RuntimeException {

    private static final String MESSAGE = "Session expired, please log in again";

    public SessionExpiredException() {
        super(MESSAGE);
    }

    public SessionExpiredException(Throwable cause) {
        super(MESSAGE, cause);
    }
}
