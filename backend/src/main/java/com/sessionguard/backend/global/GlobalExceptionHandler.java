package com.sessionguard.backend.global;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import com.sessionguard.backend.auth.external.provider.ExternalProviderUnavailableException;

import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;

/**
 * 컨트롤러 밖으로 나온 예외를 ApiError 바디로 바꾼다.
 * 상태 코드는 ErrorCode가 정하고 여기서는 고르지 않는다.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiError> handleApiException(ApiException e) {
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(e.getStatus());
        if (e.getRetryAfterSeconds() != null) {
            builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(e.getRetryAfterSeconds()));
        }
        return builder.body(ApiError.from(e));
    }

    // 어떤 필드가 왜 틀렸는지는 로그에만 남기고 응답은 VALIDATION_ERROR 하나로 통일
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleInvalidBody(MethodArgumentNotValidException e) {
        e.getBindingResult().getFieldErrors()
                .forEach(fe -> log.warn("요청 검증 실패: field={}, message={}", fe.getField(), fe.getDefaultMessage()));
        return respond(ErrorCode.VALIDATION_ERROR);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleInvalidParameter(ConstraintViolationException e) {
        e.getConstraintViolations()
                .forEach(v -> log.warn("요청 검증 실패: path={}, message={}", v.getPropertyPath(), v.getMessage()));
        return respond(ErrorCode.VALIDATION_ERROR);
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingRequestHeaderException.class
    })
    public ResponseEntity<ApiError> handleMalformedRequest(Exception e) {
        log.warn("요청 해석 실패: {}", e.getMessage());
        return respond(ErrorCode.VALIDATION_ERROR);
    }

    // 제공자 장애는 재시도 없이 502로 끝낸다
    @ExceptionHandler(ExternalProviderUnavailableException.class)
    public ResponseEntity<ApiError> handleProviderUnavailable(ExternalProviderUnavailableException e) {
        log.error("외부 인증 제공자 장애: provider={}", e.getProvider(), e);
        return respond(ErrorCode.PROVIDER_UNAVAILABLE);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnhandled(Exception e) {
        log.error("처리되지 않은 예외", e);
        return respond(ErrorCode.INTERNAL_ERROR);
    }

    private static ResponseEntity<ApiError> respond(ErrorCode code) {
        return ResponseEntity.status(code.status()).body(ApiError.of(code));
    }
}
