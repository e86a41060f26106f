package com.sessionguard.backend.auth.token.domain;

/** 리프레시 토큰이 명시적으로 무효화된 이유 (운영/감사용) */
public enum RefreshInvalidateReason {
    LOGOUT,
    REUSE_DETECTED,
    PASSWORD_CHANGED,
    SESSIONS_REVOKED
}
