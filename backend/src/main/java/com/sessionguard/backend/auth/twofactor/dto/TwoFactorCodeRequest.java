package com.sessionguard.backend.auth.twofactor.dto;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.sessionguard.backend.global.jackson.TrimStringDeserializer;

import jakarta.validation.constraints.NotBlank;

/** 설정 확인용 TOTP 코드 */
public record TwoFactorCodeRequest(
        @JsonDeserialize(using = TrimStringDeserializer.class)
        @NotBlank
        String code
) {}
