package com.sessionguard.backend.auth.external.web;

import java.util.List;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.sessionguard.backend.auth.external.dto.AuthorizeRequest;
import com.sessionguard.backend.auth.external.dto.AuthorizeResponse;
import com.sessionguard.backend.auth.external.dto.ExternalCallbackRequest;
import com.sessionguard.backend.auth.external.dto.ExternalProviderResponse;
import com.sessionguard.backend.auth.external.provider.ExternalProviderRegistry;
import com.sessionguard.backend.auth.external.service.ExternalAuthorizationService;
import com.sessionguard.backend.auth.session.service.SessionOutcome;
import com.sessionguard.backend.auth.session.service.SessionService;
import com.sessionguard.backend.auth.token.dto.TokenResponse;
import com.sessionguard.backend.auth.token.support.TokenResponseWriter;

import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * 외부 로그인 API
 *
 * 1) GET  /auth/external/providers               : 켜져 있는 제공자 목록
 * 2) POST /auth/external/{provider}/authorize    : state 발급 + authorization URL
 * 3) POST /auth/external/callback                : state 소비 → code 교환 → 토큰 또는 2FA 챌린지
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth/external")
public class ExternalAuthController {

    private final ExternalProviderRegistry registry;
    private final ExternalAuthorizationService authorizationService;
    private final SessionService sessionService;
    private final TokenResponseWriter responseWriter;

    @GetMapping("/providers")
    public List<ExternalProviderResponse> providers() {
        return registry.all().stream()
                .map(ExternalProviderResponse::from)
                .toList();
    }

    @PostMapping("/{provider}/authorize")
    public AuthorizeResponse authorize(@PathVariable("provider") String provider,
                                       @Valid @RequestBody AuthorizeRequest req) {
        return new AuthorizeResponse(authorizationService.authorize(provider, req.redirectUri()).orElseThrow());
    }

    @PostMapping("/callback")
    public TokenResponse callback(@Valid @RequestBody ExternalCallbackRequest req, HttpServletResponse response) {
        SessionOutcome outcome = sessionService.completeExternalLogin(req.state(), req.code()).orElseThrow();
        return responseWriter.write(response, outcome, req.useCookiesOrTrue());
    }
}
