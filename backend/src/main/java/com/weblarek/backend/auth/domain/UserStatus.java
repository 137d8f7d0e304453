package com.weblarek.backend.auth.domain;

// ACTIVE만 로그인/토큰 로테이션/내 정보 조회 허용
public enum UserStatus {
    ACTIVE, DISABLED
}
