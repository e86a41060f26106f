package com.sessionguard.backend.auth.cache;

import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 사용자 단위 캐시 무효화 (best-effort)
 *
 * - 트랜잭션 안에서 부르면 커밋 이후에 evict 한다.
 *   커밋 전에 지우면 그 사이 들어온 요청이 옛 stamp를 다시 캐시에 올린다.
 * - 롤백되면 아무것도 하지 않는다. (stamp가 그대로다)
 * - 실패해도 예외를 던지지 않는다. 경고 로그만 남긴다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UserCacheInvalidator {

    private final CacheManager cacheManager;

    public void evict(Long userId) {
        if (userId == null) return;

        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    evictNow(userId);
                }
            });
            return;
        }
        evictNow(userId);
    }

    private void evictNow(Long userId) {
        try {
            Cache cache = cacheManager.getCache(PrincipalCacheConfig.PRINCIPALS);
            if (cache != null) {
                cache.evict(userId);
            }
        } catch (RuntimeException e) {
            log.warn("principal 캐시 무효화 실패: userId={}", userId, e);
        }
    }
}
