package com.sessionguard.backend.auth.twofactor.dto;

import jakarta.validation.constraints.NotBlank;

/** 2FA 해제/복구 코드 재발급 전 비밀번호 재확인 */
public record PasswordConfirmRequest(
        @NotBlank
        String password
) {}
