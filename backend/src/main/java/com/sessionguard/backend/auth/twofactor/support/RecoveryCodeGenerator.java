package com.sessionguard.backend.auth.twofactor.support;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Component;

import com.sessionguard.backend.auth.token.support.TokenHashUtils;

import lombok.RequiredArgsConstructor;

/**
 * 복구 코드 생성 + 비교용 정규화/해시
 *
 * - 형식: XXXXX-XXXXX (헷갈리는 0/O/1/I 제외한 대문자+숫자)
 * - 비교는 대소문자와 '-'/공백을 무시한다.
 */
@Component
@RequiredArgsConstructor
public class RecoveryCodeGenerator {

    private static final char[] ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789".toCharArray();
    private static final int GROUP_LEN = 5;

    private final SecureRandom secureRandom;

    public List<String> generate(int count) {
        List<String> codes = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            codes.add(group() + "-" + group());
        }
        return codes;
    }

    public static String hash(String code) {
        return TokenHashUtils.sha256Hex(normalize(code));
    }

    public static String normalize(String code) {
        if (code == null) return "";
        return code.replace("-", "").replace(" ", "").trim().toUpperCase(Locale.ROOT);
    }

    private String group() {
        StringBuilder sb = new StringBuilder(GROUP_LEN);
        for (int i = 0; i < GROUP_LEN; i++) {
            sb.append(ALPHABET[secureRandom.nextInt(ALPHABET.length)]);
        }
        return sb.toString();
    }
}
