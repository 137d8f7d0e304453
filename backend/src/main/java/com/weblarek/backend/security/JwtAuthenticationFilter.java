package com.weblarek.backend.security;

import java.io.IOException;
import java.util.List;
import java.util.Set;

import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.web.filter.OncePerRequestFilter;

import com.weblarek.backend.global.ErrorCode;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Bearer access token 인증 필터
 *
 * - 헤더 없음 / Bearer 아님: 그냥 통과 (보호 경로면 EntryPoint가 AUTH_REQUIRED)
 * - 만료: 401 ACCESS_EXPIRED
 * - 그 외 검증 실패: 401 ACCESS_INVALID
 *
 * 로그인/가입/refresh/logout 은 access를 보지 않는다.
 * 만료된 access가 실려 와도 refresh와 logout은 항상 쿠키만으로 처리되어야 한다.
 */
@Slf4j
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    static final Set<String> CREDENTIAL_FREE_PATHS = Set.of(
            "/auth/login", "/auth/register", "/auth/token", "/auth/logout");

    private static final String BEARER = "Bearer ";

    private final JwtService jwtService;
    private final SecurityErrorWriter errorWriter;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return CREDENTIAL_FREE_PATHS.contains(path);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {

        String token = bearerToken(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (token == null || SecurityContextHolder.getContext().getAuthentication() != null) {
            chain.doFilter(request, response);
            return;
        }

        AuthPrincipal principal;
        try {
            principal = jwtService.verifyAccessToken(token);
        } catch (JwtService.InvalidJwtException e) {
            SecurityContextHolder.clearContext();
            ErrorCode code = (e.reason() == JwtService.Reason.EXPIRED)
                    ? ErrorCode.ACCESS_EXPIRED
                    : ErrorCode.ACCESS_INVALID;
            log.debug("access token 거부: {} {} -> {}", request.getMethod(), request.getRequestURI(), code);
            errorWriter.write(response, code);
            return;
        }

        UsernamePasswordAuthenticationToken auth = new UsernamePasswordAuthenticationToken(
                principal, null, List.of(new SimpleGrantedAuthority(principal.authority())));
        auth.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(auth);

        chain.doFilter(request, response);
    }

    // "Bearer <token>" 이 아니면 null
    static String bearerToken(String header) {
        if (header == null || !header.startsWith(BEARER)) return null;
        String token = header.substring(BEARER.length()).trim();
        return token.isEmpty() ? null : token;
    }
}
