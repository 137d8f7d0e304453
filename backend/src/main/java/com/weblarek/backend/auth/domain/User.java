package com.weblarek.backend.auth.domain;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * users 테이블 = "회원 저장소"
 *
 * - 가입: RegisterService.register()에서 insert (비밀번호는 BCrypt 해시만)
 * - 로그인: LoginService.login()에서 email로 조회 후 password_hash 비교, status로 로그인 허용 여부 결정
 * - 세션(refresh_tokens)은 user_id FK로 매달리고, 유저 삭제 시 함께 지워진다(ON DELETE CASCADE).
 */
@Entity
@Table(name = "users", uniqueConstraints = {
        @UniqueConstraint(name = "uq_users_email", columnNames = "email")
})
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id; // JWT sub

    @Column(nullable = false, length = 255)
    private String email; // 정규화된 값만 저장 (EmailNormalizer)

    @Column(name = "password_hash", nullable = false, length = 100)
    private String passwordHash;

    @Column(nullable = false, length = 30)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private UserRole role; // JWT role 클레임 -> ROLE_*

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private UserStatus status;

    @Column(name = "last_login_at")
    private LocalDateTime lastLoginAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static User create(String email, String passwordHash, String name, LocalDateTime now) {
        User u = new User();
        u.email = email;
        u.passwordHash = passwordHash;
        u.name = name;

        // 기본 정책값
        u.role = UserRole.CUSTOMER;
        u.status = UserStatus.ACTIVE;
        u.lastLoginAt = null;
        u.createdAt = now;
        return u;
    }

    public void setLastLoginAt(LocalDateTime now) {
        lastLoginAt = now;
    }

    // PATCH /auth/me. null이면 해당 필드는 그대로 둔다.
    public void updateProfile(String newName, String newEmail) {
        if (newName != null) name = newName;
        if (newEmail != null) email = newEmail;
    }

    public boolean isActive() {
        return status == UserStatus.ACTIVE;
    }

    public Long getId() {return id;}
    public UserStatus getStatus() {return status;}
    public UserRole getRole() {return role;}
    public String getPasswordHash() {return passwordHash;}
    public String getEmail() {return email;}
    public String getName() {return name;}
    public LocalDateTime getLastLoginAt() {return lastLoginAt;}
}
