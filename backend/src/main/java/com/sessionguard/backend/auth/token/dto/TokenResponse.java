package com.sessionguard.backend.auth.token.dto;

import java.time.LocalDateTime;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.sessionguard.backend.auth.token.service.TokenPair;
import com.sessionguard.backend.auth.twofactor.service.IssuedChallenge;

/**
 * 로그인/리프레시/2FA/외부 로그인 공통 응답 바디
 *
 * - 쿠키 모드: accessToken만 바디에 (refresh는 HttpOnly 쿠키로만)
 * - bearer 모드: accessToken + refreshToken 둘 다 바디에
 * - 2FA 필요: requiresTwoFactor=true + challengeToken (토큰 없음)
 * - 외부 계정 연결 완료: linkOnly=true + provider (토큰 없음, 기존 세션 유지)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TokenResponse(
        String accessToken,
        String refreshToken,
        Long expiresIn,
        Boolean requiresTwoFactor,
        String challengeToken,
        LocalDateTime challengeExpiresAt,
        Boolean newAccount,
        Boolean linkOnly,
        String provider
) {

    public static TokenResponse cookieMode(TokenPair pair, Boolean newAccount) {
        return new TokenResponse(pair.accessToken(), null, pair.accessTokenExpiresInSeconds(), null, null, null, newAccount, null, null);
    }

    public static TokenResponse bearerMode(TokenPair pair, Boolean newAccount) {
        return new TokenResponse(pair.accessToken(), pair.refreshToken(), pair.accessTokenExpiresInSeconds(), null, null, null, newAccount, null, null);
    }

    public static TokenResponse challenge(IssuedChallenge challenge, Boolean newAccount) {
        return new TokenResponse(null, null, null, true, challenge.challengeToken(), challenge.expiresAt(), newAccount, null, null);
    }

    public static TokenResponse linked(String provider) {
        return new TokenResponse(null, null, null, null, null, null, null, true, provider);
    }
}
