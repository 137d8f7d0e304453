package com.weblarek.backend.auth.config;

import java.security.SecureRandom;
import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * auth 모듈 공용 빈
 * - Clock: 토큰 만료/세션 TTL 계산의 유일한 시간 소스 (테스트는 TestClockConfig로 교체)
 * - SecureRandom: refresh 원문 생성
 * - PasswordEncoder: 자격 증명 해시 (BCrypt)
 */
@Configuration
@EnableConfigurationProperties(AuthProperties.class)
public class AuthModuleConfig {

    /**
     * 서버 시간은 UTC로 고정한다. (DB에는 LocalDateTime으로 들어가므로 존 혼용 금지)
     * 테스트에서는 TestClockConfig의 @Primary Clock이 우선한다.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }
}
