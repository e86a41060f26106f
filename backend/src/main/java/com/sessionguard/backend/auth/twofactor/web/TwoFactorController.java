package com.sessionguard.backend.auth.twofactor.web;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.sessionguard.backend.auth.session.service.SessionService;
import com.sessionguard.backend.auth.token.dto.TokenResponse;
import com.sessionguard.backend.auth.token.service.TokenPair;
import com.sessionguard.backend.auth.token.support.TokenResponseWriter;
import com.sessionguard.backend.auth.twofactor.dto.PasswordConfirmRequest;
import com.sessionguard.backend.auth.twofactor.dto.RecoveryCodesResponse;
import com.sessionguard.backend.auth.twofactor.dto.RecoveryLoginRequest;
import com.sessionguard.backend.auth.twofactor.dto.TwoFactorCodeRequest;
import com.sessionguard.backend.auth.twofactor.dto.TwoFactorSetupResponse;
import com.sessionguard.backend.auth.twofactor.dto.TwoFactorVerifyRequest;
import com.sessionguard.backend.auth.twofactor.service.TwoFactorSetupService;
import com.sessionguard.backend.security.AuthPrincipal;

import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * 2단계 인증 API
 *
 * [공개] 로그인 2단계
 * - POST /auth/2fa/verify    : 챌린지 + TOTP 코드
 * - POST /auth/2fa/recovery  : 챌린지 + 복구 코드
 *
 * [인증 필요] 설정 관리
 * - POST /auth/2fa/setup, /setup/confirm, /disable, /recovery-codes
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth/2fa")
public class TwoFactorController {

    private final SessionService sessionService;
    private final TwoFactorSetupService setupService;
    private final TokenResponseWriter responseWriter;

    @PostMapping("/verify")
    public TokenResponse verify(@Valid @RequestBody TwoFactorVerifyRequest req, HttpServletResponse response) {
        TokenPair pair = sessionService.completeTwoFactor(req.challengeToken(), req.code()).orElseThrow();
        return responseWriter.write(response, pair, req.useCookiesOrTrue());
    }

    @PostMapping("/recovery")
    public TokenResponse recovery(@Valid @RequestBody RecoveryLoginRequest req, HttpServletResponse response) {
        TokenPair pair = sessionService.completeTwoFactorWithRecoveryCode(req.challengeToken(), req.recoveryCode())
                .orElseThrow();
        return responseWriter.write(response, pair, req.useCookiesOrTrue());
    }

    @PostMapping("/setup")
    public TwoFactorSetupResponse setup(@AuthenticationPrincipal AuthPrincipal principal) {
        return TwoFactorSetupResponse.from(setupService.begin(principal.userId()).orElseThrow());
    }

    @PostMapping("/setup/confirm")
    public RecoveryCodesResponse confirm(@AuthenticationPrincipal AuthPrincipal principal,
                                         @Valid @RequestBody TwoFactorCodeRequest req) {
        return new RecoveryCodesResponse(setupService.confirm(principal.userId(), req.code()).orElseThrow());
    }

    @PostMapping("/disable")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void disable(@AuthenticationPrincipal AuthPrincipal principal,
                        @Valid @RequestBody PasswordConfirmRequest req) {
        setupService.disable(principal.userId(), req.password()).orElseThrow();
    }

    @PostMapping("/recovery-codes")
    public RecoveryCodesResponse regenerate(@AuthenticationPrincipal AuthPrincipal principal,
                                            @Valid @RequestBody PasswordConfirmRequest req) {
        return new RecoveryCodesResponse(
                setupService.regenerateRecoveryCodes(principal.userId(), req.password()).orElseThrow());
    }
}
