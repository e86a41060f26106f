package com.sessionguard.backend.auth.identity.me.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.sessionguard.backend.auth.domain.User;
import com.sessionguard.backend.auth.domain.UserRole;

/**
 * recoveryCodesRemaining은 2FA가 켜져 있을 때만 내려간다.
 * hasPassword=false 면 외부 로그인으로만 들어오는 계정 (set-password 대상)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MeResponse(
        Long userId,
        String email,
        String nickname,
        UserRole role,
        boolean twoFactorEnabled,
        boolean hasPassword,
        Long recoveryCodesRemaining,
        List<String> linkedProviders
) {

    public static MeResponse of(User user, Long recoveryCodesRemaining, List<String> linkedProviders) {
        return new MeResponse(
                user.getId(),
                user.getEmail(),
                user.getNickname(),
                user.getRole(),
                user.isTwoFactorEnabled(),
                user.hasPassword(),
                user.isTwoFactorEnabled() ? recoveryCodesRemaining : null,
                List.copyOf(linkedProviders)
        );
    }
}
