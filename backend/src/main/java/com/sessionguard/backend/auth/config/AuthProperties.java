package com.sessionguard.backend.auth.config;

import java.util.Set;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;


/*
  @ConfigurationProperties(prefix = "app.auth"):
  application.yml 의 app.auth.* 값을 타입 안정성 있게 바인딩한다.
  검증 실패 = 애플리케이션 기동 실패 (요청 단위 실패로 미루지 않는다)

  app:
    auth:
      jwt:
        issuer: sessionguard
        audience: sessionguard-api
        access-ttl-seconds: 600
        secret: ${APP_AUTH_JWT_SECRET}
        security-stamp-claim: security_stamp

      refresh:
        cookie-name: SG_REFRESH
        cookie-path: /auth
        cookie-same-site: Lax
        cookie-secure: true
        persistent-ttl-seconds: 604800
        session-ttl-seconds: 86400
 */
@Validated
@ConfigurationProperties(prefix = "app.auth")
public record AuthProperties(@Valid @NotNull Jwt jwt,
                             @Valid @NotNull Refresh refresh,
                             @Valid @NotNull AccessCookie accessCookie,
                             @Valid @NotNull Lockout lockout,
                             @Valid @NotNull Cache cache,
                             @Valid @NotNull Cleanup cleanup) {

    // JWT 등록 클레임 + 우리가 쓰는 role 클레임. security stamp 클레임 이름과 겹치면 안 된다.
    private static final Set<String> RESERVED_CLAIMS = Set.of("iss", "sub", "aud", "exp", "nbf", "iat", "jti", "role");

    /**
     * Access Token(JWT) 관련 설정
     * - issuer / audience: 발급자, 수신자 식별자 (검증 시 requireIssuer / requireAudience)
     * - accessTtlSeconds: 1분 ~ 2시간
     * - secret: HS256 서명을 위한 비밀키 문자열 (32바이트 이상)
     * - securityStampClaim: 보안 스탬프 해시를 실을 클레임 이름
     */
    public record Jwt(
        @NotBlank String issuer,
        @NotBlank String audience,
        @Min(60) @Max(7200) long accessTtlSeconds,
        @NotBlank @Size(min = 32) String secret,
        @NotBlank String securityStampClaim
    ) {
        @AssertTrue(message = "securityStampClaim must not collide with reserved JWT claims")
        public boolean isSecurityStampClaimAllowed() {
            return securityStampClaim == null || !RESERVED_CLAIMS.contains(securityStampClaim);
        }
    }


    /**
     * Refresh Token + 쿠키 관련 설정
     * - persistentTtlSeconds: rememberMe=true 일 때 수명 (1일 ~ 365일)
     * - sessionTtlSeconds: rememberMe=false 일 때 수명 (10분 ~ 30일, persistent 이하)
     */
    public record Refresh(
            @NotBlank String cookieName,

            // 최소 형식만 강제: "/"로 시작 (오타로 "auth" 같은 값 들어오는 것 방지)
            @NotBlank @Pattern(regexp = "^/.*", message = "cookiePath must start with '/'")
            String cookiePath,

            @NotNull SameSite cookieSameSite,

            boolean cookieSecure,

            @Min(86_400) @Max(31_536_000) long persistentTtlSeconds,

            @Min(600) @Max(2_592_000) long sessionTtlSeconds
    ) {
        @AssertTrue(message = "sessionTtlSeconds must not exceed persistentTtlSeconds")
        public boolean isSessionWithinPersistent() {
            return sessionTtlSeconds <= persistentTtlSeconds;
        }
    }

    /** Access Token 쿠키 (useCookies=true 일 때만 사용) */
    public record AccessCookie(
            @NotBlank String name,
            @NotBlank @Pattern(regexp = "^/.*", message = "path must start with '/'") String path
    ) {}

    /** 비밀번호 연속 실패 잠금 정책 */
    public record Lockout(
            @Min(1) int maxFailedAttempts,
            @Min(1) long lockoutSeconds
    ) {}

    /** principal 스냅샷 캐시 (토큰 유효성의 근거가 아닌 파생 데이터) */
    public record Cache(
            @Min(1) long principalTtlSeconds,
            @Min(1) long principalMaxSize
    ) {}

    /** 만료/사용된 행 정리 주기 */
    public record Cleanup(
            @NotBlank String cron,
            @Min(0) long graceSeconds
    ) {}

    // SameSite는 오타가 치명적이라 enum으로 고정
    public enum SameSite {
        Lax, Strict, None
    }
}
