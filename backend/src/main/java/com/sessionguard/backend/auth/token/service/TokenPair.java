package com.sessionguard.backend.auth.token.service;

import java.time.LocalDateTime;

/**
 * 한 번의 발급/로테이션 결과.
 * - refreshToken은 원문이다. 응답(쿠키 또는 바디)으로 한 번 나가고 서버에는 해시만 남는다.
 */
public record TokenPair(
        String accessToken,
        long accessTokenExpiresInSeconds,
        String refreshToken,
        LocalDateTime refreshTokenExpiresAt,
        boolean rememberMe
) {
    @Override
    public String toString() {
        // 토큰 원문이 로그에 섞이지 않게
        return "TokenPair[rememberMe=" + rememberMe + ", refreshTokenExpiresAt=" + refreshTokenExpiresAt + "]";
    }
}
