package com.weblarek.client;

/**
 * refresh 실패로 세션이 강제 종료됐을 때 호출된다 (UI라면 로그인 화면으로 이동).
 * 세션 저장소와 쿠키는 호출 전에 이미 비워져 있다.
 */
@FunctionalInterface
public interface ForcedLogoutListener {

    ForcedLogoutListener NO_OP = cause -> { };

    void onForcedLogout(Throwable cause);
}
