package com.sessionguard.backend.auth.twofactor.support;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import org.apache.commons.codec.binary.Base32;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.sessionguard.backend.auth.config.TwoFactorProperties;

class TotpVerifierTest {

    // RFC 6238 부록 B의 SHA1 시드 ("12345678901234567890")
    private static final String RFC_SECRET =
            new Base32().encodeToString("12345678901234567890".getBytes(StandardCharsets.US_ASCII));

    private static final TwoFactorProperties PROPS = new TwoFactorProperties("SessionGuard", 300, 5, 10, 1);

    private static TotpVerifier at(Instant now) {
        return new TotpVerifier(PROPS, new SecureRandom(), Clock.fixed(now, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("RFC 6238 테스트 벡터 (8자리 값의 하위 6자리)")
    void matches_rfc_vectors() {
        TotpVerifier verifier = at(Instant.EPOCH);

        assertThat(verifier.codeAt(RFC_SECRET, Instant.ofEpochSecond(59))).isEqualTo("287082");
        assertThat(verifier.codeAt(RFC_SECRET, Instant.ofEpochSecond(1111111109))).isEqualTo("081804");
        assertThat(verifier.codeAt(RFC_SECRET, Instant.ofEpochSecond(1234567890))).isEqualTo("005924");
    }

    @Test
    @DisplayName("앞뒤 1스텝까지만 허용")
    void allows_one_step_drift() {
        Instant now = Instant.ofEpochSecond(1_700_000_010);
        TotpVerifier verifier = at(now);
        String secret = verifier.newSecret();

        assertThat(verifier.verify(secret, verifier.codeAt(secret, now))).isTrue();
        assertThat(verifier.verify(secret, verifier.codeAt(secret, now.minusSeconds(30)))).isTrue();
        assertThat(verifier.verify(secret, verifier.codeAt(secret, now.plusSeconds(30)))).isTrue();
        assertThat(verifier.verify(secret, verifier.codeAt(secret, now.minusSeconds(120)))).isFalse();
    }

    @Test
    @DisplayName("형식이 맞지 않는 입력 → false")
    void rejects_malformed_codes() {
        TotpVerifier verifier = at(Instant.EPOCH);
        String secret = verifier.newSecret();

        assertThat(verifier.verify(secret, null)).isFalse();
        assertThat(verifier.verify(secret, "12345")).isFalse();
        assertThat(verifier.verify(secret, "abcdef")).isFalse();
        assertThat(verifier.verify(null, "123456")).isFalse();
    }

    @Test
    @DisplayName("코드 사이 공백은 무시")
    void ignores_spaces() {
        Instant now = Instant.ofEpochSecond(1_700_000_000);
        TotpVerifier verifier = at(now);
        String secret = verifier.newSecret();
        String code = verifier.codeAt(secret, now);

        assertThat(verifier.verify(secret, code.substring(0, 3) + " " + code.substring(3))).isTrue();
    }

    @Test
    @DisplayName("otpauth URI에 issuer/secret 포함")
    void builds_authenticator_uri() {
        TotpVerifier verifier = at(Instant.EPOCH);

        assertThat(verifier.authenticatorUri("anna@example.com", "ABC"))
                .isEqualTo("otpauth://totp/SessionGuard:anna%40example.com?secret=ABC&issuer=SessionGuard&digits=6");
    }
}
