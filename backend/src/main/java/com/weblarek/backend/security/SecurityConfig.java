package com.weblarek.backend.security;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

import com.weblarek.backend.auth.domain.UserRole;

import lombok.RequiredArgsConstructor;

/**
 * Spring Security 전역 설정
 *
 * - 세션 없음(STATELESS): 로그인 상태는 access token(헤더) + refresh 쿠키(DB 세션)로만 표현한다.
 * - JwtAuthenticationFilter: Bearer 검증 (만료 ACCESS_EXPIRED / 불량 ACCESS_INVALID)
 * - RestAuthEntryPoint: 인증 없음 -> 401 AUTH_REQUIRED
 * - RestAccessDeniedHandler: 역할 부족 -> 403 FORBIDDEN
 *
 * CSRF는 끈다. refresh 쿠키는 SameSite=Strict + Path=/auth 이고,
 * 쿠키만으로 할 수 있는 일은 로테이션/로그아웃뿐이다(응답 바디는 교차 출처에서 읽을 수 없다).
 */
@Configuration
@RequiredArgsConstructor
public class SecurityConfig {

    private final JwtService jwtService;
    private final SecurityErrorWriter securityErrorWriter;

    @Bean
    RestAuthEntryPoint restAuthEntryPoint() {
        return new RestAuthEntryPoint(securityErrorWriter);
    }

    @Bean
    RestAccessDeniedHandler restAccessDeniedHandler() {
        return new RestAccessDeniedHandler(securityErrorWriter);
    }

    @Bean
    JwtAuthenticationFilter jwtAuthenticationFilter() {
        return new JwtAuthenticationFilter(jwtService, securityErrorWriter);
    }

    @Bean
    SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        return http
                .csrf(csrf -> csrf.disable())
                .httpBasic(b -> b.disable())
                .formLogin(f -> f.disable())
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .exceptionHandling(eh -> eh
                        .authenticationEntryPoint(restAuthEntryPoint())
                        .accessDeniedHandler(restAccessDeniedHandler()))
                .addFilterBefore(jwtAuthenticationFilter(), UsernamePasswordAuthenticationFilter.class)
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers("/error").permitAll()
                        .requestMatchers("/actuator/health/**").permitAll()

                        // 인증 필요 없는 Auth 엔드포인트 (refresh 쿠키 or 자격 증명으로 동작)
                        .requestMatchers(HttpMethod.POST, "/auth/login", "/auth/register").permitAll()
                        .requestMatchers(HttpMethod.GET, "/auth/token", "/auth/logout").permitAll()

                        .requestMatchers("/auth/admin/**").hasRole(UserRole.ADMIN.name())

                        // 그 외는 인증 필요 (/auth/user, /auth/me 포함)
                        .anyRequest().authenticated()
                )
                .build();
    }
}
