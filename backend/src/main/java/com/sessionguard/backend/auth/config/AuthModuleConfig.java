package com.sessionguard.backend.auth.config;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneId;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * 세션 코어가 공유하는 기반 빈: 설정 바인딩, 시계, 난수원, 비밀번호 해시.
 * 정리 작업(@Scheduled) 때문에 스케줄링도 여기서 켠다.
 */
@Configuration
@EnableScheduling
@EnableConfigurationProperties({
        AuthProperties.class,
        TwoFactorProperties.class,
        ExternalAuthProperties.class
})
public class AuthModuleConfig {

    private static final int BCRYPT_STRENGTH = 10;

    /**
     * DB의 LocalDateTime 컬럼과 같은 시간대여야 한다. (hibernate.jdbc.time_zone)
     * 테스트는 시계를 직접 움직이는 Clock 빈을 따로 올린다.
     */
    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock(@Value("${app.time-zone:Asia/Seoul}") String zoneId) {
        return Clock.system(ZoneId.of(zoneId));
    }

    // 토큰 원문, 챌린지, state, TOTP 시크릿, 복구 코드가 모두 여기서 나온다
    @Bean
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder(BCRYPT_STRENGTH);
    }
}
