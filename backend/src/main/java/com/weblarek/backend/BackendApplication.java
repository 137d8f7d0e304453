package com.weblarek.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.context.annotation.Import;

import com.weblarek.backend.auth.config.AuthModuleConfig;

/*
================================================================================
[curl 시나리오]  (register / login / token / user / logout 흐름 검증)
================================================================================
# 회원가입 201 (쿠키 파일에 refresh 저장)
curl -i -X POST "http://localhost:8080/auth/register" \
  -H "Content-Type: application/json" \
  -c /tmp/weblarek_cookie.txt \
  -d '{"email":"anna@weblarek.ru","password":"larek-pass-1","name":"Anna"}'

# 로그인 200
curl -i -X POST "http://localhost:8080/auth/login" \
  -H "Content-Type: application/json" \
  -c /tmp/weblarek_cookie.txt \
  -d '{"email":"anna@weblarek.ru","password":"larek-pass-1"}'
- 바디: {"success":true,"user":{...},"accessToken":"..."}
- 헤더: Set-Cookie: refreshToken=...; Path=/auth; HttpOnly; SameSite=Strict

# 내 정보 200 (accessToken 넣어서)
curl -i "http://localhost:8080/auth/user" -H "Authorization: Bearer <accessToken>"
- 만료: 401 ACCESS_EXPIRED / 서명·형식 불량: 401 ACCESS_INVALID

# 토큰 로테이션 (기존 쿠키 보내고 새 쿠키로 덮어쓰기)
curl -i "http://localhost:8080/auth/token" \
  -b /tmp/weblarek_cookie.txt \
  -c /tmp/weblarek_cookie_new.txt
- 같은 쿠키로 한 번 더 호출하면 401 + 쿠키 삭제(Max-Age=0) 가 정상

# 로그아웃 (항상 200 + 쿠키 삭제)
curl -i "http://localhost:8080/auth/logout" -b /tmp/weblarek_cookie_new.txt

================================================================================
[DB 확인]
================================================================================
select * from users;
select id, user_id, remember_me, expires_at, revoked_at, revoke_reason from refresh_tokens;
*/

/**
 * 애플리케이션 엔트리포인트
 *
 * - com.weblarek.backend 하위(auth, security, global)를 컴포넌트 스캔한다.
 * - 설정 주입 흐름: 환경변수 -> application.yml(${ENV:default}) -> AuthProperties(@ConfigurationProperties)
 * - JWT 방식이라 기본 인메모리 유저를 만드는 UserDetailsServiceAutoConfiguration은 끈다.
 */
@Import(AuthModuleConfig.class)
@SpringBootApplication(exclude = {UserDetailsServiceAutoConfiguration.class})
public class BackendApplication {
    public static void main(String[] args) {
        SpringApplication.run(BackendApplication.class, args);
    }
}
