package com.sessionguard.backend.auth.twofactor.dto;

import com.sessionguard.backend.auth.twofactor.service.TwoFactorSetupService.SetupKey;

public record TwoFactorSetupResponse(String sharedKey, String authenticatorUri) {

    public static TwoFactorSetupResponse from(SetupKey key) {
        return new TwoFactorSetupResponse(key.sharedKey(), key.authenticatorUri());
    }
}
