package com.sessionguard.backend.auth.identity.session.web;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.sessionguard.backend.auth.session.service.SessionService;
import com.sessionguard.backend.auth.token.support.AuthCookieUtils;
import com.sessionguard.backend.security.AuthPrincipal;

import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * POST: /auth/sessions/revoke-all (모든 기기에서 로그아웃)
 * - 호출한 클라이언트의 쿠키도 지운다.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth/sessions")
public class AuthSessionController {

    private final SessionService sessionService;
    private final AuthCookieUtils cookieUtils;

    @PostMapping("/revoke-all")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void revokeAll(@AuthenticationPrincipal AuthPrincipal principal, HttpServletResponse response) {
        sessionService.revokeAllSessions(principal.userId()).orElseThrow();
        cookieUtils.clearTokenCookies(response);
    }
}
