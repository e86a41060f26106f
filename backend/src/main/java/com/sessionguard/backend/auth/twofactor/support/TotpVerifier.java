package com.sessionguard.backend.auth.twofactor.support;

import java.net.URLEncoder;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import org.apache.commons.codec.binary.Base32;
import org.springframework.stereotype.Component;

import com.sessionguard.backend.auth.config.TwoFactorProperties;

import lombok.RequiredArgsConstructor;

/**
 * TOTP (RFC 6238) 생성/검증
 *
 * - HMAC-SHA1, 30초 스텝, 6자리 (일반 인증 앱 기본값)
 * - 시크릿은 20바이트 난수를 Base32(패딩 제거)로 보관한다.
 * - 검증은 현재 스텝 기준 ±allowedTimeStepDrift 스텝을 허용한다.
 */
@Component
@RequiredArgsConstructor
public class TotpVerifier {

    private static final String HMAC_ALGORITHM = "HmacSHA1";
    private static final int SECRET_BYTES = 20;
    private static final long TIME_STEP_SECONDS = 30;
    private static final int DIGITS = 6;
    private static final int MODULUS = 1_000_000;

    private final TwoFactorProperties props;
    private final SecureRandom secureRandom;
    private final Clock clock;

    public String newSecret() {
        byte[] bytes = new byte[SECRET_BYTES];
        secureRandom.nextBytes(bytes);
        return new Base32().encodeToString(bytes).replace("=", "");
    }

    public boolean verify(String base32Secret, String code) {
        if (base32Secret == null || base32Secret.isBlank()) return false;
        String normalized = normalize(code);
        if (normalized == null) return false;

        long currentStep = timeStep(clock.instant());
        int drift = props.allowedTimeStepDrift();
        byte[] given = normalized.getBytes(StandardCharsets.US_ASCII);

        boolean matched = false;
        for (int i = -drift; i <= drift; i++) {
            byte[] expected = codeForStep(base32Secret, currentStep + i).getBytes(StandardCharsets.US_ASCII);
            // 조기 종료 없이 전부 비교
            matched |= MessageDigest.isEqual(expected, given);
        }
        return matched;
    }

    /** 특정 시각의 코드 (설정 화면 안내/테스트용) */
    public String codeAt(String base32Secret, Instant at) {
        return codeForStep(base32Secret, timeStep(at));
    }

    /** 인증 앱 QR 용 otpauth URI */
    public String authenticatorUri(String accountEmail, String base32Secret) {
        String issuer = props.issuer();
        return "otpauth://totp/" + encode(issuer) + ":" + encode(accountEmail)
                + "?secret=" + base32Secret
                + "&issuer=" + encode(issuer)
                + "&digits=" + DIGITS;
    }

    private String codeForStep(String base32Secret, long step) {
        byte[] key = new Base32().decode(base32Secret.toUpperCase());
        byte[] counter = ByteBuffer.allocate(Long.BYTES).putLong(step).array();

        byte[] hash;
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(key, HMAC_ALGORITHM));
            hash = mac.doFinal(counter);
        } catch (GeneralSecurityException e) {
            // JDK 기본 제공 알고리즘이라 여기 오면 런타임 환경 문제다.
            throw new IllegalStateException("HmacSHA1 unavailable", e);
        }

        // dynamic truncation
        int offset = hash[hash.length - 1] & 0x0f;
        int binary = ((hash[offset] & 0x7f) << 24)
                | ((hash[offset + 1] & 0xff) << 16)
                | ((hash[offset + 2] & 0xff) << 8)
                | (hash[offset + 3] & 0xff);

        return String.format("%0" + DIGITS + "d", binary % MODULUS);
    }

    private static long timeStep(Instant at) {
        return Math.floorDiv(at.getEpochSecond(), TIME_STEP_SECONDS);
    }

    private static String normalize(String code) {
        if (code == null) return null;
        String c = code.replace(" ", "").trim();
        if (c.length() != DIGITS) return null;
        for (int i = 0; i < c.length(); i++) {
            if (!Character.isDigit(c.charAt(i))) return null;
        }
        return c;
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
