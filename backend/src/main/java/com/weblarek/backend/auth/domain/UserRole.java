package com.weblarek.backend.auth.domain;

/**
 * 사용자 역할. JWT role 클레임과 Spring Security 권한(ROLE_*)의 원천.
 * - CUSTOMER: 스토어 고객 (가입 기본값)
 * - ADMIN: 관리자 화면 / 세션 강제 종료
 */
public enum UserRole {
    CUSTOMER, ADMIN
}
