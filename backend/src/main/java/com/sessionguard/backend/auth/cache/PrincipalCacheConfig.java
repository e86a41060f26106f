package com.sessionguard.backend.auth.cache;

import java.util.concurrent.TimeUnit;

import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.sessionguard.backend.auth.config.AuthProperties;

/**
 * 로컬(Caffeine) 캐시 설정
 *
 * - principals: userId -> PrincipalSnapshot (role, security stamp 해시)
 *   매 인증 요청마다 users 테이블을 치지 않기 위한 읽기 캐시.
 *   토큰 유효성의 근거가 아니다. 리프레시 토큰 상태는 절대 캐시하지 않는다.
 * - TTL을 짧게 두고, 로그아웃/비밀번호 변경/재사용 탐지 시 즉시 evict 한다.
 */
@Configuration
@EnableCaching
public class PrincipalCacheConfig {

    public static final String PRINCIPALS = "principals";

    @Bean
    public CacheManager cacheManager(AuthProperties props) {
        AuthProperties.Cache cache = props.cache();

        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(PRINCIPALS,
                Caffeine.newBuilder()
                        .expireAfterWrite(cache.principalTtlSeconds(), TimeUnit.SECONDS)
                        .maximumSize(cache.principalMaxSize())
                        .build());
        return manager;
    }
}
