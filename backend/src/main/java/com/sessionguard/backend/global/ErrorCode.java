package com.sessionguard.backend.global;

import org.springframework.http.HttpStatus;

/**
 * 에러 종류(kind) + HTTP 상태 + 기본 메시지 + 외부 노출 코드의 단일 소스.
 *
 * 원칙:
 * - 세션 보안 코어가 돌려주는 실패는 전부 이 enum 중 하나다. (닫힌 분류)
 * - publicCode는 응답 바디의 code 필드로 나간다. 대부분 name()과 같다.
 * - TOKEN_REUSED는 외부에 TOKEN_INVALIDATED로만 보인다.
 *   재사용 탐지 여부는 감사 로그로만 구분한다. (공격자에게 탐지 오라클을 주지 않음)
 */
public enum ErrorCode {

    // Login / Credential
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED,
            "이메일 또는 비밀번호가 올바르지 않습니다."),
    ACCOUNT_LOCKED(HttpStatus.FORBIDDEN,
            "로그인 시도가 너무 많아 계정이 잠겼습니다. 잠시 후 다시 시도해주세요."),

    // Auth / Security
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED,
            "인증이 필요합니다."),
    ACCESS_INVALID(HttpStatus.UNAUTHORIZED,
            "엑세스 토큰이 유효하지 않습니다."),

    // Refresh token
    TOKEN_MISSING(HttpStatus.UNAUTHORIZED,
            "리프레시 토큰이 없습니다."),
    TOKEN_NOT_FOUND(HttpStatus.UNAUTHORIZED,
            "리프레시 토큰이 유효하지 않습니다."),
    TOKEN_EXPIRED(HttpStatus.UNAUTHORIZED,
            Messages.SESSION_ENDED),
    TOKEN_INVALIDATED(HttpStatus.UNAUTHORIZED,
            Messages.SESSION_ENDED),
    TOKEN_REUSED(HttpStatus.UNAUTHORIZED,
            Messages.SESSION_ENDED, "TOKEN_INVALIDATED"), // 보안상 코드/메시지 뭉개기

    // Two-factor
    CHALLENGE_NOT_FOUND(HttpStatus.UNAUTHORIZED,
            "2단계 인증 요청을 찾을 수 없거나 만료되었습니다."),
    CHALLENGE_EXPIRED(HttpStatus.UNAUTHORIZED,
            "2단계 인증 요청이 만료되었습니다. 다시 로그인해주세요."),
    CHALLENGE_LOCKED(HttpStatus.UNAUTHORIZED,
            "인증 시도 횟수를 초과했습니다. 다시 로그인해주세요."),
    INVALID_CODE(HttpStatus.BAD_REQUEST,
            "인증 코드가 올바르지 않습니다."),

    // External provider
    PROVIDER_EXCHANGE_FAILED(HttpStatus.BAD_REQUEST,
            "외부 로그인에 실패했습니다."),
    NO_USABLE_EMAIL(HttpStatus.BAD_REQUEST,
            "외부 계정에서 사용할 수 있는 이메일을 찾지 못했습니다."),
    PROVIDER_UNAVAILABLE(HttpStatus.BAD_GATEWAY,
            "외부 인증 제공자에 연결할 수 없습니다."),

    // Validation / Common
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST,
            "요청 값이 올바르지 않습니다."),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR,
            "서버 오류가 발생했습니다.");

    private final HttpStatus status;
    private final String defaultMessage;
    private final String publicCode;

    ErrorCode(HttpStatus status, String defaultMessage) {
        this(status, defaultMessage, null);
    }

    ErrorCode(HttpStatus status, String defaultMessage, String publicCode) {
        this.status = status;
        this.defaultMessage = defaultMessage;
        this.publicCode = publicCode;
    }

    public HttpStatus status() {
        return status;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    /** 응답 바디에 실리는 code 값 */
    public String publicCode() {
        return publicCode != null ? publicCode : name();
    }

    private static final class Messages {
        static final String SESSION_ENDED = "세션이 만료되었습니다. 다시 로그인해주세요.";
    }
}
