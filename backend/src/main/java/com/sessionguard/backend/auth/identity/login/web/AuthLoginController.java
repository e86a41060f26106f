package com.sessionguard.backend.auth.identity.login.web;

import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.sessionguard.backend.auth.identity.login.dto.LoginRequest;
import com.sessionguard.backend.auth.session.service.SessionOutcome;
import com.sessionguard.backend.auth.session.service.SessionService;
import com.sessionguard.backend.auth.token.dto.TokenResponse;
import com.sessionguard.backend.auth.token.support.TokenResponseWriter;

import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * 로그인 API
 *
 * - 요청(JSON) 검증: @Valid DTO
 * - 핵심 로직: SessionService (자격 증명/잠금/2FA 분기/토큰 발급)
 * - 응답 변환: TokenResponseWriter (쿠키 모드 / bearer 모드 / 2FA 챌린지)
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth")
public class AuthLoginController {

    private final SessionService sessionService;
    private final TokenResponseWriter responseWriter;

    @PostMapping("/login")
    public TokenResponse login(@Valid @RequestBody LoginRequest req, HttpServletResponse response) {

        SessionOutcome outcome = sessionService.login(
                req.email(),
                req.password(),
                req.rememberMeOrFalse()
        ).orElseThrow();

        return responseWriter.write(response, outcome, req.useCookiesOrTrue());
    }
}
