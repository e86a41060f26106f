package com.sessionguard.backend.auth.token.support;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

import org.apache.commons.codec.digest.DigestUtils;

/**
 * 불투명 토큰(리프레시/2FA 챌린지/외부 state/복구 코드) 해시 유틸
 *
 * - 원문이 DB에 저장되면 유출 시 바로 악용 가능하다.
 * - DB에는 sha256 hex(64)만 저장하고, 들어온 원문을 같은 방식으로 해싱해 조회 키로 쓴다.
 *   : incoming raw -> sha256Hex -> token_hash 유니크 조회
 * - 한 비트만 달라도 해시가 달라지므로 조회 자체가 실패한다. (부분 일치 없음)
 */
public final class TokenHashUtils {
    private TokenHashUtils() {}

    /** raw 문자열을 SHA-256 해시 후 소문자 hex(64 chars)로 반환 */
    public static String sha256Hex(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("raw token must not be null/blank");
        }
        return DigestUtils.sha256Hex(raw.getBytes(StandardCharsets.UTF_8));
    }

    /** 해시 문자열 상수 시간 비교 */
    public static boolean hashEquals(String a, String b) {
        if (a == null || b == null) return false;
        return MessageDigest.isEqual(
                a.getBytes(StandardCharsets.UTF_8),
                b.getBytes(StandardCharsets.UTF_8)
        );
    }
}
