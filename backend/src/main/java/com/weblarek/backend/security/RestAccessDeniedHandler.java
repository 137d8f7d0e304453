package com.weblarek.backend.security;

import java.io.IOException;

import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.web.access.AccessDeniedHandler;

import com.weblarek.backend.global.ErrorCode;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 인증은 됐지만 역할이 부족할 때 -> 403 FORBIDDEN
 * 401이 아니므로 클라이언트는 refresh를 시도하지 않는다.
 */
@Slf4j
@RequiredArgsConstructor
public class RestAccessDeniedHandler implements AccessDeniedHandler {

    private final SecurityErrorWriter errorWriter;

    @Override
    public void handle(
            HttpServletRequest request,
            HttpServletResponse response,
            AccessDeniedException accessDeniedException) throws IOException {

        log.warn("권한 부족: uri={}, principal={}", request.getRequestURI(),
                request.getUserPrincipal() == null ? null : request.getUserPrincipal().getName());
        errorWriter.write(response, ErrorCode.FORBIDDEN);
    }
}
