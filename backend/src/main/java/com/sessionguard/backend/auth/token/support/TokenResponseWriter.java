package com.sessionguard.backend.auth.token.support;

import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import com.sessionguard.backend.auth.session.service.SessionOutcome;
import com.sessionguard.backend.auth.token.dto.TokenResponse;
import com.sessionguard.backend.auth.token.service.TokenPair;

import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * 세션 결과 → HTTP 응답 (쿠키/bearer 어댑터)
 *
 * - useCookies=true: access/refresh 쿠키 세팅 + 바디에는 access만
 * - useCookies=false: 쿠키 없이 바디에 둘 다
 * - 토큰이 실린 응답은 캐시 금지
 * - 연결 전용 callback은 쿠키를 건드리지 않는다. (이미 로그인된 세션 그대로)
 */
@Component
@RequiredArgsConstructor
public class TokenResponseWriter {

    private final AuthCookieUtils cookieUtils;

    public TokenResponse write(HttpServletResponse response, TokenPair pair, boolean useCookies) {
        return write(response, pair, useCookies, null);
    }

    public TokenResponse write(HttpServletResponse response, SessionOutcome outcome, boolean useCookies) {
        if (outcome.isLinkOnly()) {
            return TokenResponse.linked(outcome.linkedProvider());
        }
        Boolean newAccount = outcome.newAccount() ? Boolean.TRUE : null;
        if (outcome.requiresTwoFactor()) {
            noStore(response);
            return TokenResponse.challenge(outcome.challenge(), newAccount);
        }
        return write(response, outcome.tokens(), useCookies, newAccount);
    }

    private TokenResponse write(HttpServletResponse response, TokenPair pair, boolean useCookies, Boolean newAccount) {
        noStore(response);
        if (useCookies) {
            cookieUtils.setTokenCookies(response, pair);
            return TokenResponse.cookieMode(pair, newAccount);
        }
        return TokenResponse.bearerMode(pair, newAccount);
    }

    private static void noStore(HttpServletResponse response) {
        response.setHeader(HttpHeaders.CACHE_CONTROL, "no-store");
        response.setHeader(HttpHeaders.PRAGMA, "no-cache");
    }
}
