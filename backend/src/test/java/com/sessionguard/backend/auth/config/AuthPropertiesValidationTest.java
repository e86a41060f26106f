package com.sessionguard.backend.auth.config;

import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

/**
 * app.auth.* 설정 검증: 잘못된 값이면 컨텍스트 기동 자체가 실패해야 한다.
 */
class AuthPropertiesValidationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropertiesConfig.class)
            .withPropertyValues(
                    "app.auth.jwt.issuer=sessionguard",
                    "app.auth.jwt.audience=sessionguard-api",
                    "app.auth.jwt.access-ttl-seconds=600",
                    "app.auth.jwt.secret=0123456789abcdef0123456789abcdef",
                    "app.auth.jwt.security-stamp-claim=security_stamp",
                    "app.auth.refresh.cookie-name=SG_REFRESH",
                    "app.auth.refresh.cookie-path=/auth",
                    "app.auth.refresh.cookie-same-site=Lax",
                    "app.auth.refresh.cookie-secure=true",
                    "app.auth.refresh.persistent-ttl-seconds=604800",
                    "app.auth.refresh.session-ttl-seconds=86400",
                    "app.auth.access-cookie.name=SG_ACCESS",
                    "app.auth.access-cookie.path=/",
                    "app.auth.lockout.max-failed-attempts=5",
                    "app.auth.lockout.lockout-seconds=900",
                    "app.auth.cache.principal-ttl-seconds=60",
                    "app.auth.cache.principal-max-size=10000",
                    "app.auth.cleanup.cron=0 0 * * * *",
                    "app.auth.cleanup.grace-seconds=86400");

    @Test
    @DisplayName("정상 설정 → 바인딩 성공")
    void binds_valid_settings() {
        runner.run(context -> {
            assertThat(context).hasNotFailed();
            AuthProperties props = context.getBean(AuthProperties.class);
            assertThat(props.jwt().accessTtlSeconds()).isEqualTo(600);
            assertThat(props.refresh().cookieSameSite()).isEqualTo(AuthProperties.SameSite.Lax);
        });
    }

    @Test
    @DisplayName("session 수명 > persistent 수명 → 기동 실패")
    void rejects_session_ttl_longer_than_persistent() {
        runner.withPropertyValues(
                        "app.auth.refresh.persistent-ttl-seconds=86400",
                        "app.auth.refresh.session-ttl-seconds=172800")
                .run(context -> assertThat(context).getFailure()
                        .rootCause()
                        .isInstanceOf(BindValidationException.class)
                        .hasMessageContaining("sessionTtlSeconds must not exceed persistentTtlSeconds"));
    }

    @Test
    @DisplayName("서명 secret 32자 미만 → 기동 실패")
    void rejects_short_secret() {
        runner.withPropertyValues("app.auth.jwt.secret=too-short-secret")
                .run(context -> assertThat(context).getFailure()
                        .rootCause()
                        .isInstanceOf(BindValidationException.class)
                        .hasMessageContaining("secret"));
    }

    @Test
    @DisplayName("access TTL 60초 미만 → 기동 실패")
    void rejects_access_ttl_below_minimum() {
        runner.withPropertyValues("app.auth.jwt.access-ttl-seconds=59")
                .run(context -> assertThat(context).getFailure()
                        .rootCause()
                        .isInstanceOf(BindValidationException.class)
                        .hasMessageContaining("accessTtlSeconds"));
    }

    @Test
    @DisplayName("access TTL 2시간 초과 → 기동 실패")
    void rejects_access_ttl_above_maximum() {
        runner.withPropertyValues("app.auth.jwt.access-ttl-seconds=7201")
                .run(context -> assertThat(context).getFailure()
                        .rootCause()
                        .isInstanceOf(BindValidationException.class)
                        .hasMessageContaining("accessTtlSeconds"));
    }

    @Test
    @DisplayName("security stamp 클레임 이름이 등록 클레임과 겹침 → 기동 실패")
    void rejects_stamp_claim_collision() {
        runner.withPropertyValues("app.auth.jwt.security-stamp-claim=sub")
                .run(context -> assertThat(context).getFailure()
                        .rootCause()
                        .isInstanceOf(BindValidationException.class)
                        .hasMessageContaining("securityStampClaim must not collide with reserved JWT claims"));
    }

    @Test
    @DisplayName("role 클레임과 겹쳐도 기동 실패")
    void rejects_stamp_claim_named_role() {
        runner.withPropertyValues("app.auth.jwt.security-stamp-claim=role")
                .run(context -> assertThat(context).hasFailed());
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(AuthProperties.class)
    static class PropertiesConfig {
    }
}
