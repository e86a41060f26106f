package com.sessionguard.backend.auth.audit;

/** 감사 로그 이벤트 종류 */
public enum AuditAction {
    LOGIN_SUCCESS,
    LOGIN_FAILED,
    LOGIN_LOCKED_OUT,

    TWO_FACTOR_CHALLENGE_ISSUED,
    TWO_FACTOR_VERIFIED,
    TWO_FACTOR_FAILED,
    TWO_FACTOR_LOCKED,
    RECOVERY_CODE_USED,
    TWO_FACTOR_ENABLED,
    TWO_FACTOR_DISABLED,
    RECOVERY_CODES_REGENERATED,

    REFRESH_TOKEN_REUSED,
    LOGOUT,
    PASSWORD_CHANGED,
    PASSWORD_SET,
    SESSIONS_REVOKED,
    PERMISSIONS_CHANGED,

    EXTERNAL_LOGIN_SUCCESS,
    EXTERNAL_LOGIN_FAILED,
    EXTERNAL_ACCOUNT_LINKED,
    EXTERNAL_ACCOUNT_UNLINKED,
    EXTERNAL_ACCOUNT_CREATED
}
