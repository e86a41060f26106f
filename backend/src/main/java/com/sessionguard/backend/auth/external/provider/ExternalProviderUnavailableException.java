package com.sessionguard.backend.auth.external.provider;

import lombok.Getter;

/**
 * 제공자 장애 (5xx / 타임아웃 / 연결 실패)
 * - 세션 코어는 잡지 않는다. GlobalExceptionHandler가 502로 바꾼다.
 */
@Getter
public class ExternalProviderUnavailableException extends RuntimeException {

    private final String provider;

    public ExternalProviderUnavailableException(String provider, String message) {
        super(message);
        this.provider = provider;
    }

    public ExternalProviderUnavailableException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }
}
