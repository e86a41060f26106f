package com.sessionguard.backend.auth.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

class UserCacheInvalidatorTest {

    @Test
    @DisplayName("evict → 해당 userId 스냅샷만 제거")
    void evicts_single_user() {
        CacheManager manager = new ConcurrentMapCacheManager(PrincipalCacheConfig.PRINCIPALS);
        Cache cache = manager.getCache(PrincipalCacheConfig.PRINCIPALS);
        cache.put(1L, "one");
        cache.put(2L, "two");

        new UserCacheInvalidator(manager).evict(1L);

        assertThat(cache.get(1L)).isNull();
        assertThat(cache.get(2L)).isNotNull();
    }

    @Test
    @DisplayName("캐시 백엔드 장애 → 예외 없이 넘어간다 (best-effort)")
    void swallows_cache_failures() {
        CacheManager manager = mock(CacheManager.class);
        Cache cache = mock(Cache.class);
        given(manager.getCache(PrincipalCacheConfig.PRINCIPALS)).willReturn(cache);
        willThrow(new IllegalStateException("cache down")).given(cache).evict(1L);

        assertThatCode(() -> new UserCacheInvalidator(manager).evict(1L)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("userId null → 아무것도 하지 않음")
    void ignores_null_user() {
        CacheManager manager = mock(CacheManager.class);

        new UserCacheInvalidator(manager).evict(null);

        verifyNoInteractions(manager);
    }

    @Test
    @DisplayName("트랜잭션 안 evict → 커밋 전엔 남아 있고, afterCommit에서 제거")
    void defers_evict_until_commit() {
        CacheManager manager = new ConcurrentMapCacheManager(PrincipalCacheConfig.PRINCIPALS);
        Cache cache = manager.getCache(PrincipalCacheConfig.PRINCIPALS);
        cache.put(1L, "one");

        TransactionSynchronizationManager.initSynchronization();
        try {
            new UserCacheInvalidator(manager).evict(1L);
            assertThat(cache.get(1L)).isNotNull();

            TransactionSynchronizationManager.getSynchronizations().forEach(TransactionSynchronization::afterCommit);
            assertThat(cache.get(1L)).isNull();
        } finally {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    @DisplayName("트랜잭션 롤백 → evict 하지 않는다")
    void keeps_entry_on_rollback() {
        CacheManager manager = new ConcurrentMapCacheManager(PrincipalCacheConfig.PRINCIPALS);
        Cache cache = manager.getCache(PrincipalCacheConfig.PRINCIPALS);
        cache.put(1L, "one");

        TransactionSynchronizationManager.initSynchronization();
        try {
            new UserCacheInvalidator(manager).evict(1L);
            TransactionSynchronizationManager.getSynchronizations()
                    .forEach(sync -> sync.afterCompletion(TransactionSynchronization.STATUS_ROLLED_BACK));
        } finally {
            TransactionSynchronizationManager.clearSynchronization();
        }

        assertThat(cache.get(1L)).isNotNull();
    }
}
