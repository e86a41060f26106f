package com.sessionguard.backend.auth.identity.password.web;

import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.sessionguard.backend.auth.identity.password.dto.ChangePasswordRequest;
import com.sessionguard.backend.auth.identity.password.dto.SetPasswordRequest;
import com.sessionguard.backend.auth.session.service.SessionService;
import com.sessionguard.backend.auth.token.dto.TokenResponse;
import com.sessionguard.backend.auth.token.service.TokenPair;
import com.sessionguard.backend.auth.token.support.TokenResponseWriter;
import com.sessionguard.backend.security.AuthPrincipal;

import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * POST: /auth/password      비밀번호 변경 (현재 비밀번호 확인)
 * POST: /auth/password/set  비밀번호 설정 (외부 로그인으로 만든, 비밀번호 없는 계정)
 * - 둘 다 성공하면 다른 세션은 전부 끊기고, 이 클라이언트만 새 쌍을 받는다.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth")
public class AuthPasswordController {

    private final SessionService sessionService;
    private final TokenResponseWriter responseWriter;

    @PostMapping("/password")
    public TokenResponse changePassword(@AuthenticationPrincipal AuthPrincipal principal,
                                        @Valid @RequestBody ChangePasswordRequest req,
                                        HttpServletResponse response) {
        TokenPair pair = sessionService.changePassword(
                principal.userId(),
                req.currentPassword(),
                req.newPassword(),
                req.rememberMeOrFalse()
        ).orElseThrow();

        return responseWriter.write(response, pair, req.useCookiesOrTrue());
    }

    @PostMapping("/password/set")
    public TokenResponse setPassword(@AuthenticationPrincipal AuthPrincipal principal,
                                     @Valid @RequestBody SetPasswordRequest req,
                                     HttpServletResponse response) {
        TokenPair pair = sessionService.setPassword(
                principal.userId(),
                req.newPassword(),
                req.rememberMeOrFalse()
        ).orElseThrow();

        return responseWriter.write(response, pair, req.useCookiesOrTrue());
    }
}
