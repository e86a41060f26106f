package com.sessionguard.backend.security;

import java.io.IOException;

import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;

import com.sessionguard.backend.global.ErrorCode;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 보호된 경로에 자격 증명 없이 들어온 경우 → UNAUTHORIZED.
 * 토큰이 있는데 틀린 경우는 JwtAuthenticationFilter가 먼저 ACCESS_INVALID로 끊는다.
 */
@Slf4j
@RequiredArgsConstructor
public class RestAuthEntryPoint implements AuthenticationEntryPoint {

    private final SecurityErrorWriter errorWriter;

    @Override
    public void commence(
            HttpServletRequest request,
            HttpServletResponse response,
            AuthenticationException authException) throws IOException {

        log.debug("인증 없는 요청 차단: {} {}", request.getMethod(), request.getRequestURI());
        errorWriter.write(response, ErrorCode.UNAUTHORIZED);
    }
}
