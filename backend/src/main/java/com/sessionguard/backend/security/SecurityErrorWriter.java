package com.sessionguard.backend.security;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sessionguard.backend.global.ApiError;
import com.sessionguard.backend.global.ErrorCode;

import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * 필터 체인에서 끊긴 요청에 ApiError JSON을 직접 쓴다.
 *
 * 컨트롤러까지 가지 못한 요청은 GlobalExceptionHandler를 거치지 않으므로
 * 응답 모양을 여기서 맞춘다. 401이면 Bearer 챌린지 헤더도 붙인다.
 */
@Component
@RequiredArgsConstructor
public class SecurityErrorWriter {

    private final ObjectMapper objectMapper;

    public void write(HttpServletResponse response, ErrorCode errorCode) throws IOException {
        if (response.isCommitted()) {
            return;
        }

        response.setHeader(HttpHeaders.CACHE_CONTROL, "no-store");
        response.setHeader(HttpHeaders.PRAGMA, "no-cache");
        if (errorCode.status() == HttpStatus.UNAUTHORIZED) {
            response.setHeader(HttpHeaders.WWW_AUTHENTICATE, bearerChallenge(errorCode));
        }

        response.setStatus(errorCode.status().value());
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);

        objectMapper.writeValue(response.getWriter(), ApiError.of(errorCode));
    }

    // RFC 6750: 토큰이 없으면 error 속성 없이, 토큰이 틀렸으면 invalid_token
    private static String bearerChallenge(ErrorCode errorCode) {
        if (errorCode == ErrorCode.ACCESS_INVALID) {
            return "Bearer error=\"invalid_token\"";
        }
        return "Bearer";
    }
}
