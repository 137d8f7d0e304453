package com.weblarek.backend.auth.identity.me.service;

import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.weblarek.backend.auth.domain.User;
import com.weblarek.backend.auth.identity.dto.UserResponse;
import com.weblarek.backend.auth.repo.UserRepository;
import com.weblarek.backend.global.ApiException;
import com.weblarek.backend.global.ErrorCode;
import com.weblarek.backend.security.AuthPrincipal;

import lombok.RequiredArgsConstructor;

/**
 * 내 정보 조회/수정 유스케이스
 *
 * 정책:
 * - 인증이 없으면 AUTH_REQUIRED
 * - 토큰은 유효하지만 사용자 없음 -> USER_NOT_FOUND (비정상 상태)
 * - 계정 상태가 ACTIVE가 아니면 -> ACCOUNT_DISABLED
 */
@Service
@RequiredArgsConstructor
public class MeService {

    private final UserRepository userRepository;

    @Transactional(readOnly = true)
    public UserResponse me(AuthPrincipal principal) {
        return UserResponse.from(loadActiveUser(principal));
    }

    @Transactional(readOnly = true)
    public List<String> roles(AuthPrincipal principal) {
        return UserResponse.from(loadActiveUser(principal)).roles();
    }

    @Transactional
    public UserResponse updateMe(AuthPrincipal principal, String newName, String newEmail) {
        User user = loadActiveUser(principal);

        String name = (newName == null) ? null : newName.trim();
        String email = (newEmail == null || newEmail.equals(user.getEmail())) ? null : newEmail;

        if (email != null && userRepository.existsByEmailAndIdNot(email, user.getId())) {
            throw new ApiException(ErrorCode.EMAIL_ALREADY_EXISTS);
        }

        user.updateProfile(name, email);
        userRepository.flush();
        return UserResponse.from(user);
    }

    private User loadActiveUser(AuthPrincipal principal) {
        if (principal == null || principal.userId() == null) {
            throw new ApiException(ErrorCode.AUTH_REQUIRED);
        }

        User user = userRepository.findById(principal.userId())
                .orElseThrow(() -> new ApiException(ErrorCode.USER_NOT_FOUND));

        if (!user.isActive()) {
            throw new ApiException(ErrorCode.ACCOUNT_DISABLED);
        }
        return user;
    }
}
