package com.sessionguard.backend.auth.token.web;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.sessionguard.backend.auth.session.service.SessionService;
import com.sessionguard.backend.auth.token.dto.RefreshTokenRequest;
import com.sessionguard.backend.auth.token.support.AuthCookieUtils;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * POST: /auth/logout
 *
 * 멱등:
 * - 쿠키/바디 없음, 모르는 토큰, 이미 무효화된 토큰 => 전부 204
 * - 두 쿠키 삭제 Set-Cookie는 항상 내려간다.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth")
public class AuthLogoutController {

    private final SessionService sessionService;
    private final AuthCookieUtils cookieUtils;

    @PostMapping("/logout")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void logout(@RequestBody(required = false) RefreshTokenRequest body,
                       HttpServletRequest request,
                       HttpServletResponse response) {
        String refreshRaw = cookieUtils.readRefreshCookie(request);
        if (refreshRaw == null && body != null) {
            refreshRaw = body.refreshToken();
        }

        sessionService.logout(refreshRaw);
        cookieUtils.clearTokenCookies(response);
    }
}
