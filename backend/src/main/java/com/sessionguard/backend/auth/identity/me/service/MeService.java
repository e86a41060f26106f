package com.sessionguard.backend.auth.identity.me.service;

import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.sessionguard.backend.auth.domain.User;
import com.sessionguard.backend.auth.external.domain.ExternalLogin;
import com.sessionguard.backend.auth.external.repo.ExternalLoginRepository;
import com.sessionguard.backend.auth.identity.me.dto.MeResponse;
import com.sessionguard.backend.auth.repo.UserRepository;
import com.sessionguard.backend.auth.twofactor.service.RecoveryCodeService;
import com.sessionguard.backend.global.ErrorCode;
import com.sessionguard.backend.global.Result;
import com.sessionguard.backend.security.AuthPrincipal;

import lombok.RequiredArgsConstructor;

/**
 * 현재 로그인한 사용자의 계정 상태 조회.
 * 필터 통과 직후 계정이 지워졌으면 ACCESS_INVALID.
 */
@Service
@RequiredArgsConstructor
public class MeService {

    private final UserRepository userRepository;
    private final ExternalLoginRepository externalLoginRepository;
    private final RecoveryCodeService recoveryCodeService;

    @Transactional(readOnly = true)
    public Result<MeResponse> me(AuthPrincipal principal) {
        if (principal == null) {
            return Result.failure(ErrorCode.UNAUTHORIZED);
        }
        return userRepository.findById(principal.userId())
                .map(user -> Result.success(describe(user)))
                .orElseGet(() -> Result.failure(ErrorCode.ACCESS_INVALID));
    }

    private MeResponse describe(User user) {
        Long remaining = user.isTwoFactorEnabled() ? recoveryCodeService.remaining(user.getId()) : null;
        List<String> providers = externalLoginRepository.findAllByUserId(user.getId()).stream()
                .map(ExternalLogin::getProvider)
                .distinct()
                .sorted()
                .toList();
        return MeResponse.of(user, remaining, providers);
    }
}
