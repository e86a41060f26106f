package com.sessionguard.backend.security;

import java.util.Objects;

import com.sessionguard.backend.auth.cache.PrincipalSnapshot;
import com.sessionguard.backend.auth.domain.UserRole;

/**
 * SecurityContext에 올라가는 인증 주체.
 * securityStampHash는 access 토큰의 stamp 클레임과 같은 값이다.
 */
public record AuthPrincipal(Long userId, UserRole role, String securityStampHash) {

    public AuthPrincipal {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(role, "role");
    }

    /** 필터가 stamp 비교를 통과시킨 현재 사용자 상태로 주체를 만든다. */
    public static AuthPrincipal from(PrincipalSnapshot snapshot) {
        return new AuthPrincipal(snapshot.userId(), snapshot.role(), snapshot.securityStampHash());
    }

    public boolean matchesStampOf(PrincipalSnapshot snapshot) {
        return snapshot != null && Objects.equals(snapshot.securityStampHash(), securityStampHash);
    }

    public String authority() {
        return "ROLE_" + role.name();
    }
}
