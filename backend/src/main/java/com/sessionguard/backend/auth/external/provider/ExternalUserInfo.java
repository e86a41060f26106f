package com.sessionguard.backend.auth.external.provider;

/**
 * 제공자 교환 결과 (저장하지 않는 값)
 * - providerKey: 제공자 쪽의 안정적인 사용자 식별자 (sub, id)
 * - emailVerified: 제공자가 검증했다고 알려준 경우에만 true
 */
public record ExternalUserInfo(
        String providerKey,
        String email,
        boolean emailVerified,
        String firstName,
        String lastName
) {}
