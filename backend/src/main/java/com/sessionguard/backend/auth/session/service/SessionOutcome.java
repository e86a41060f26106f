package com.sessionguard.backend.auth.session.service;

import com.sessionguard.backend.auth.token.service.TokenPair;
import com.sessionguard.backend.auth.twofactor.service.IssuedChallenge;

/**
 * 로그인 계열 결과: 토큰 쌍 / 2FA 챌린지 / 연결 완료(linkedProvider) 중 정확히 하나.
 * - newAccount: 외부 로그인으로 방금 만들어진 계정이면 true
 * - linkedProvider: 로그인된 사용자의 연결 요청이었으면 제공자 이름 (토큰 없음)
 */
public record SessionOutcome(TokenPair tokens, IssuedChallenge challenge, String linkedProvider, boolean newAccount) {

    public SessionOutcome {
        int set = (tokens != null ? 1 : 0) + (challenge != null ? 1 : 0) + (linkedProvider != null ? 1 : 0);
        if (set != 1) {
            throw new IllegalArgumentException("exactly one of tokens / challenge / linkedProvider must be set");
        }
    }

    public static SessionOutcome authenticated(TokenPair tokens) {
        return new SessionOutcome(tokens, null, null, false);
    }

    public static SessionOutcome authenticated(TokenPair tokens, boolean newAccount) {
        return new SessionOutcome(tokens, null, null, newAccount);
    }

    public static SessionOutcome twoFactorRequired(IssuedChallenge challenge) {
        return new SessionOutcome(null, challenge, null, false);
    }

    public static SessionOutcome twoFactorRequired(IssuedChallenge challenge, boolean newAccount) {
        return new SessionOutcome(null, challenge, null, newAccount);
    }

    public static SessionOutcome linked(String provider) {
        return new SessionOutcome(null, null, provider, false);
    }

    public boolean requiresTwoFactor() {
        return challenge != null;
    }

    public boolean isLinkOnly() {
        return linkedProvider != null;
    }
}
