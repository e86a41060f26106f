package com.sessionguard.backend.global;

import org.springframework.http.HttpStatus;

import lombok.Getter;

/**
 * 실패한 Result를 HTTP 경계로 넘기는 예외
 *
 * 서비스는 던지지 않는다. 컨트롤러의 result.orElseThrow()에서만 만들어지고
 * GlobalExceptionHandler가 ApiError(+ Retry-After)로 바꾼다.
 */
@Getter
public class ApiException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Long retryAfterSeconds;

    public ApiException(ErrorCode errorCode) {
        this(errorCode, null, null);
    }

    public ApiException(ErrorCode errorCode, String message, Long retryAfterSeconds) {
        super(message == null || message.isBlank() ? defaultMessageOf(errorCode) : message);
        this.errorCode = errorCode;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public HttpStatus getStatus() {
        return errorCode.status();
    }

    /** 응답 바디의 code (TOKEN_REUSED도 밖에서는 TOKEN_INVALIDATED) */
    public String getCode() {
        return errorCode.publicCode();
    }

    private static String defaultMessageOf(ErrorCode errorCode) {
        if (errorCode == null) throw new IllegalArgumentException("ErrorCode must not be null");
        return errorCode.defaultMessage();
    }
}
