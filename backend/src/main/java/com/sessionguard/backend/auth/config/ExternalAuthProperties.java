package com.sessionguard.backend.auth.config;

import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

/**
 * 외부 OAuth2 로그인 설정 (app.auth.external)
 *
 * - allowedRedirectUris: authorize 요청에서 허용하는 redirect URI (정확히 일치해야 함)
 * - stateTtlSeconds: state 유효 시간 (1분 ~ 30분)
 * - connect/read timeout: 제공자 HTTP 호출 상한. 타임아웃 = 실패, 재시도 없음
 * - google / github: 제공자별 설정. enabled=true면 clientId/clientSecret 필수
 */
@Validated
@ConfigurationProperties(prefix = "app.auth.external")
public record ExternalAuthProperties(
        @NotEmpty List<@NotBlank String> allowedRedirectUris,
        @Min(60) @Max(1800) long stateTtlSeconds,
        @Min(100) int connectTimeoutMillis,
        @Min(100) int readTimeoutMillis,
        @Valid @NotNull Google google,
        @Valid @NotNull GitHub github
) {

    /** OIDC userinfo 방식 제공자 */
    public record Google(
            boolean enabled,
            String clientId,
            String clientSecret,
            @NotBlank String authorizationUri,
            @NotBlank String tokenUri,
            @NotBlank String userInfoUri
    ) {
        @AssertTrue(message = "google clientId/clientSecret are required when enabled")
        public boolean isCredentialsPresentWhenEnabled() {
            return !enabled || (hasText(clientId) && hasText(clientSecret));
        }
    }

    /** 프로필 + 이메일 목록 엔드포인트 방식 제공자 */
    public record GitHub(
            boolean enabled,
            String clientId,
            String clientSecret,
            @NotBlank String authorizationUri,
            @NotBlank String tokenUri,
            @NotBlank String userUri,
            @NotBlank String emailsUri
    ) {
        @AssertTrue(message = "github clientId/clientSecret are required when enabled")
        public boolean isCredentialsPresentWhenEnabled() {
            return !enabled || (hasText(clientId) && hasText(clientSecret));
        }
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
