package com.sessionguard.backend.global;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 에러 응답 바디. ControllerAdvice, EntryPoint, JWT 필터가 모두 이 모양으로 내보낸다.
 *
 * - code: 클라이언트 분기용 (ErrorCode.publicCode())
 * - retryAfterSeconds: 기다리면 풀리는 실패(계정 잠금)에만 있다. Retry-After 헤더와 같은 값
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(String code, String message, Long retryAfterSeconds) {

    public static ApiError of(ErrorCode errorCode) {
        return new ApiError(errorCode.publicCode(), errorCode.defaultMessage(), null);
    }

    public static ApiError of(ErrorCode errorCode, String message) {
        return new ApiError(errorCode.publicCode(), message, null);
    }

    public static ApiError from(ApiException e) {
        return new ApiError(e.getCode(), e.getMessage(), e.getRetryAfterSeconds());
    }
}
