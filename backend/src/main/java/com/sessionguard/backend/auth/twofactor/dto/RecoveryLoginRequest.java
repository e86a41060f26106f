package com.sessionguard.backend.auth.twofactor.dto;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.sessionguard.backend.global.jackson.TrimStringDeserializer;

import jakarta.validation.constraints.NotBlank;

public record RecoveryLoginRequest(
        @NotBlank
        String challengeToken,

        @JsonDeserialize(using = TrimStringDeserializer.class)
        @NotBlank
        String recoveryCode,

        Boolean useCookies
) {
    public boolean useCookiesOrTrue() {
        return !Boolean.FALSE.equals(useCookies);
    }
}
