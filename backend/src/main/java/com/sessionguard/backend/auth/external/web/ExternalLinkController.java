package com.sessionguard.backend.auth.external.web;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.sessionguard.backend.auth.external.dto.AuthorizeRequest;
import com.sessionguard.backend.auth.external.dto.AuthorizeResponse;
import com.sessionguard.backend.auth.external.service.ExternalAuthorizationService;
import com.sessionguard.backend.auth.external.service.ExternalLinkService;
import com.sessionguard.backend.security.AuthPrincipal;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * 로그인된 사용자의 외부 계정 연결 관리 (인증 필요)
 *
 * 1) POST   /auth/external-links/{provider}/authorize : 연결용 state 발급. callback은 /auth/external/callback 그대로
 * 2) DELETE /auth/external-links/{provider}           : 연결 해제
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth/external-links")
public class ExternalLinkController {

    private final ExternalAuthorizationService authorizationService;
    private final ExternalLinkService linkService;

    @PostMapping("/{provider}/authorize")
    public AuthorizeResponse authorizeLink(@AuthenticationPrincipal AuthPrincipal principal,
                                           @PathVariable("provider") String provider,
                                           @Valid @RequestBody AuthorizeRequest req) {
        return new AuthorizeResponse(
                authorizationService.authorizeLink(principal.userId(), provider, req.redirectUri()).orElseThrow());
    }

    @DeleteMapping("/{provider}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void unlink(@AuthenticationPrincipal AuthPrincipal principal,
                       @PathVariable("provider") String provider) {
        linkService.unlink(principal.userId(), provider).orElseThrow();
    }
}
