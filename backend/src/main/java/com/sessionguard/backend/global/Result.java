package com.sessionguard.backend.global;

import java.util.Objects;
import java.util.function.Function;

/**
 * 성공 값 또는 (ErrorCode + 메시지) 중 하나를 담는 결과 타입.
 *
 * - 비밀번호 불일치, 토큰 만료, 잠긴 챌린지처럼 "예상된 실패"는 예외 대신 Result로 돌려준다.
 * - DB 장애/설정 오류 같은 진짜 예외 상황만 throw 된다.
 * - HTTP 경계에서는 orElseThrow()로 ApiException으로 바꿔 GlobalExceptionHandler에 넘긴다.
 */
public final class Result<T> {

    private final T value;
    private final ErrorCode error;
    private final String message;
    private final Long retryAfterSeconds;

    private Result(T value, ErrorCode error, String message, Long retryAfterSeconds) {
        this.value = value;
        this.error = error;
        this.message = message;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public static <T> Result<T> success(T value) {
        return new Result<>(value, null, null, null);
    }

    public static <T> Result<T> failure(ErrorCode error) {
        Objects.requireNonNull(error, "error must not be null");
        return new Result<>(null, error, error.defaultMessage(), null);
    }

    public static <T> Result<T> failure(ErrorCode error, String message) {
        Objects.requireNonNull(error, "error must not be null");
        return new Result<>(null, error, (message == null || message.isBlank()) ? error.defaultMessage() : message, null);
    }

    /** 잠금처럼 기다리면 풀리는 실패. 경계에서 Retry-After 헤더가 된다. */
    public static <T> Result<T> failureRetryAfter(ErrorCode error, long retryAfterSeconds) {
        Objects.requireNonNull(error, "error must not be null");
        return new Result<>(null, error, error.defaultMessage(), Math.max(0, retryAfterSeconds));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    public T value() {
        if (error != null) {
            throw new IllegalStateException("failed result has no value: " + error);
        }
        return value;
    }

    public ErrorCode error() {
        return error;
    }

    public String message() {
        return message;
    }

    /** 없으면 null */
    public Long retryAfterSeconds() {
        return retryAfterSeconds;
    }

    private <R> Result<R> sameFailure() {
        return new Result<>(null, error, message, retryAfterSeconds);
    }

    public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        if (error != null) return sameFailure();
        return success(mapper.apply(value));
    }

    public <R> Result<R> flatMap(Function<? super T, Result<R>> mapper) {
        if (error != null) return sameFailure();
        return mapper.apply(value);
    }

    /** 실패를 같은 종류/메시지의 다른 타입 Result로 옮긴다. */
    public <R> Result<R> castFailure() {
        if (error == null) {
            throw new IllegalStateException("castFailure() on a successful result");
        }
        return sameFailure();
    }

    public T orElseThrow() {
        if (error != null) {
            throw new ApiException(error, message, retryAfterSeconds);
        }
        return value;
    }

    @Override
    public String toString() {
        return isSuccess() ? "Result[success]" : "Result[" + error + ": " + message + "]";
    }
}
