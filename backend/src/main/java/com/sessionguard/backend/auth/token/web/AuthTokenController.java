package com.sessionguard.backend.auth.token.web;

import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.sessionguard.backend.auth.session.service.SessionService;
import com.sessionguard.backend.auth.token.dto.RefreshTokenRequest;
import com.sessionguard.backend.auth.token.dto.TokenResponse;
import com.sessionguard.backend.auth.token.service.TokenPair;
import com.sessionguard.backend.auth.token.support.AuthCookieUtils;
import com.sessionguard.backend.auth.token.support.TokenResponseWriter;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * POST: /auth/refresh
 *
 * - refresh 쿠키가 있으면 쿠키 모드: 새 쿠키 두 개 + 바디에 access
 * - 없으면 바디의 refreshToken으로 bearer 모드: 바디에 새 쌍
 * - 실패(없음/미발급/만료/무효/재사용)는 Result → ApiException 으로 변환된다.
 *   재사용 탐지는 응답에서 무효화와 구분되지 않는다.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth")
public class AuthTokenController {

    private final SessionService sessionService;
    private final AuthCookieUtils cookieUtils;
    private final TokenResponseWriter responseWriter;

    @PostMapping("/refresh")
    public TokenResponse refresh(@RequestBody(required = false) RefreshTokenRequest body,
                                 HttpServletRequest request,
                                 HttpServletResponse response) {
        String fromCookie = cookieUtils.readRefreshCookie(request);
        boolean cookieMode = fromCookie != null;
        String refreshRaw = cookieMode ? fromCookie : (body == null ? null : body.refreshToken());

        TokenPair pair = sessionService.refresh(refreshRaw).orElseThrow();
        return responseWriter.write(response, pair, cookieMode);
    }
}
