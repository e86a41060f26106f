package com.sessionguard.backend.auth.identity.password.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record SetPasswordRequest(
        @NotBlank
        @Size(min = 8, max = 64)
        String newPassword,

        Boolean rememberMe,

        Boolean useCookies
) {
    public boolean rememberMeOrFalse() {
        return Boolean.TRUE.equals(rememberMe);
    }

    public boolean useCookiesOrTrue() {
        return !Boolean.FALSE.equals(useCookies);
    }
}
