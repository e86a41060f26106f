package com.sessionguard.backend.auth.token.support;

import java.security.SecureRandom;
import java.util.Base64;

import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

/**
 * 서버가 발급하는 불투명 값들의 원문 생성기.
 * 원문은 응답으로 한 번 나가고, DB에는 TokenHashUtils.sha256Hex 결과만 남는다.
 */
@Component
@RequiredArgsConstructor
public class TokenGenerator {

    // 384비트. URL-safe Base64로 64자
    private static final int SESSION_TOKEN_BYTES = 48;

    // 외부 로그인 state는 쿼리 파라미터로 왕복하므로 조금 짧게
    private static final int STATE_BYTES = 32;

    private final SecureRandom secureRandom;

    public String newRefreshToken() {
        return randomUrlSafe(SESSION_TOKEN_BYTES);
    }

    public String newChallengeToken() {
        return randomUrlSafe(SESSION_TOKEN_BYTES);
    }

    public String newExternalState() {
        return randomUrlSafe(STATE_BYTES);
    }

    /** 외부 로그인으로 생긴 계정의 비밀번호 자리. 아무도 모르는 값이라 비밀번호 로그인은 불가능하다. */
    public String newUnusablePassword() {
        return randomUrlSafe(SESSION_TOKEN_BYTES);
    }

    private String randomUrlSafe(int byteCount) {
        byte[] bytes = new byte[byteCount];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
