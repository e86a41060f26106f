package com.sessionguard.backend.auth.external.dto;

import com.sessionguard.backend.auth.external.provider.ExternalAuthProvider;

public record ExternalProviderResponse(String name, String displayName) {

    public static ExternalProviderResponse from(ExternalAuthProvider provider) {
        return new ExternalProviderResponse(provider.name(), provider.displayName());
    }
}
